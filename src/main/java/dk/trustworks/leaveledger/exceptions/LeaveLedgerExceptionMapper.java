package dk.trustworks.leaveledger.exceptions;

import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import lombok.extern.jbosslog.JBossLog;

import java.util.LinkedHashMap;
import java.util.Map;

@JBossLog
@Provider
public class LeaveLedgerExceptionMapper implements ExceptionMapper<LeaveLedgerException> {

    @Override
    public Response toResponse(LeaveLedgerException exception) {
        LeaveLedgerException.ErrorType type = exception.getErrorType();
        log.debugf("Ledger request refused with %s: %s", type, exception.getMessage());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("code", type.name());
        body.put("message", exception.getMessage());
        if (exception instanceof InsufficientBalanceException insufficient) {
            body.put("remaining", insufficient.getRemaining());
            body.put("requested", insufficient.getRequested());
        }
        return Response.status(type.getStatus())
                .type(MediaType.APPLICATION_JSON)
                .entity(body)
                .build();
    }
}
