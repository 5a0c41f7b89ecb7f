package com.consullo.workbench.state;

import org.apache.commons.lang3.Validate;

/**
 * Application-wide error shown until cleared.
 *
 * @param code machine readable code
 * @param message human readable message
 * @param context optional detail, such as the path or id the error concerns
 */
public record AppError(String code, String message, String context) {

  public AppError {
    Validate.notBlank(code, "code must not be blank");
    Validate.notNull(message, "message must not be null");
  }
}
