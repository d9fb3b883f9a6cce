package com.libragraph.chatvault.api;

import com.libragraph.chatvault.core.ArchiveException;
import com.libragraph.chatvault.core.archive.ArchiveUnavailableException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

import java.util.Map;

/**
 * Maps archive failures to JSON errors: 503 when no archive is installed, 500 otherwise.
 */
@Provider
public class ArchiveExceptionMapper implements ExceptionMapper<ArchiveException> {
    private static final Logger log = Logger.getLogger(ArchiveExceptionMapper.class);

    @Override
    public Response toResponse(ArchiveException e) {
        Response.Status status = e instanceof ArchiveUnavailableException
                ? Response.Status.SERVICE_UNAVAILABLE
                : Response.Status.INTERNAL_SERVER_ERROR;
        if (status == Response.Status.INTERNAL_SERVER_ERROR) {
            log.warn("Chat archive could not be opened", e);
        }
        return Response.status(status)
                .type(MediaType.APPLICATION_JSON)
                .entity(Map.of("error", e.getMessage()))
                .build();
    }
}
