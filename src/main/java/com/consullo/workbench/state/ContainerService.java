package com.consullo.workbench.state;

import org.apache.commons.lang3.Validate;

/**
 * A container-backed development service reported by the container runtime wrapper.
 *
 * @param id service id
 * @param name display name
 * @param image container image
 * @param status runtime status as reported by the wrapper
 * @param port published port, or {@code null}
 */
public record ContainerService(String id, String name, String image, String status, Integer port) {

  public ContainerService {
    Validate.notBlank(id, "id must not be blank");
    Validate.notNull(name, "name must not be null");
    Validate.notNull(image, "image must not be null");
    Validate.notNull(status, "status must not be null");
  }
}
