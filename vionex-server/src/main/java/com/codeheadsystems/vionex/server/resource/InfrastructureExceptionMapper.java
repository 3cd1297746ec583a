package com.codeheadsystems.vionex.server.resource;

import com.codeheadsystems.vionex.model.auth.ErrorResponse;
import com.codeheadsystems.vionex.server.error.AuthInfrastructureException;
import com.codeheadsystems.vionex.server.error.StoreUnavailableException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders infrastructure faults as 503 (store) or 500 (hashing) with a generic body.
 * The cause is logged, never returned to the client.
 */
public class InfrastructureExceptionMapper implements ExceptionMapper<AuthInfrastructureException> {

  private static final Logger log = LoggerFactory.getLogger(InfrastructureExceptionMapper.class);

  @Override
  public Response toResponse(AuthInfrastructureException exception) {
    log.error("Request failed: {}", exception.getMessage(), exception);
    String message = exception instanceof StoreUnavailableException
        ? "Service temporarily unavailable"
        : "Internal server error";
    return Response.status(exception.httpStatus())
        .type(MediaType.APPLICATION_JSON_TYPE)
        .entity(ErrorResponse.of(message))
        .build();
  }
}
