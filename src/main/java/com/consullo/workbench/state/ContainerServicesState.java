package com.consullo.workbench.state;

import java.util.List;

/**
 * Global container service state, shared by all projects.
 *
 * @param available whether a container runtime was detected
 * @param services known services
 */
public record ContainerServicesState(boolean available, List<ContainerService> services) {

  public static final ContainerServicesState UNKNOWN = new ContainerServicesState(false, List.of());

  public ContainerServicesState {
    services = services == null ? List.of() : List.copyOf(services);
  }
}
