package com.ammann.trialanalysis.exception;

import com.ammann.trialanalysis.dto.ErrorResponseDTO;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

/**
 * Global JAX-RS exception mapper that translates engine exceptions into structured JSON
 * error responses with appropriate HTTP status codes.
 *
 * <p>Unhandled exceptions are logged at ERROR level and returned as HTTP 500 responses.
 */
@Provider
public class GlobalExceptionHandler implements ExceptionMapper<Exception>
{
    private static final Logger LOG = Logger.getLogger(GlobalExceptionHandler.class);

    @Context
    UriInfo uriInfo;

    @Override
    public Response toResponse(Exception exception)
    {
        String path = uriInfo != null ? uriInfo.getPath() : null;

        if (exception instanceof InsufficientDataException) {
            LOG.debugf("Insufficient data for %s: %s", path, exception.getMessage());
            return createResponse(Response.Status.BAD_REQUEST, exception.getMessage(), "INSUFFICIENT_DATA", path);
        }

        if (exception instanceof ValidationException) {
            return createResponse(Response.Status.BAD_REQUEST, exception.getMessage(), "VALIDATION_ERROR", path);
        }

        if (exception instanceof ConcurrentCalibrationException) {
            LOG.warnf("Rejected calibration request for %s: %s", path, exception.getMessage());
            return createResponse(Response.Status.CONFLICT, exception.getMessage(), "CALIBRATION_IN_PROGRESS", path);
        }

        if (exception instanceof CalibrationException) {
            LOG.warnf("Trial source error: %s", exception.getMessage());
            return createResponse(
                    Response.Status.SERVICE_UNAVAILABLE, exception.getMessage(), "TRIAL_SOURCE_ERROR", path);
        }

        if (exception instanceof InvalidConfigurationException) {
            LOG.errorf("Configuration error: %s", exception.getMessage());
            return createResponse(
                    Response.Status.INTERNAL_SERVER_ERROR, exception.getMessage(), "INVALID_CONFIGURATION", path);
        }

        if (exception instanceof NotFoundException) {
            return createResponse(Response.Status.NOT_FOUND, exception.getMessage(), "NOT_FOUND", path);
        }

        LOG.error("Unhandled exception: " + exception.getClass().getSimpleName(), exception);
        return createResponse(
                Response.Status.INTERNAL_SERVER_ERROR,
                "An unexpected error occurred",
                "INTERNAL_ERROR",
                path
        );
    }

    private Response createResponse(Response.Status status, String message, String code, String path)
    {
        ErrorResponseDTO body = ErrorResponseDTO.of(code, message, path, status.getStatusCode());
        return Response.status(status).entity(body).build();
    }
}
