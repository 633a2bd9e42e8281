package ai.advisory.api;

import ai.advisory.api.model.ErrorResponse;
import ai.advisory.orchestrator.NoAdvisorsRegisteredException;
import ai.advisory.orchestrator.RoundCancelledException;
import ai.advisory.orchestrator.UnknownAdvisorException;
import ai.advisory.service.ProposalNotFoundException;
import ai.advisory.service.UnknownSessionException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler({UnknownSessionException.class, UnknownAdvisorException.class, ProposalNotFoundException.class})
    public ResponseEntity<ErrorResponse> notFound(RuntimeException e) {
        return error(HttpStatus.NOT_FOUND, "NOT_FOUND", e);
    }

    @ExceptionHandler(NoAdvisorsRegisteredException.class)
    public ResponseEntity<ErrorResponse> noAdvisors(NoAdvisorsRegisteredException e) {
        return error(HttpStatus.CONFLICT, "NO_ADVISORS", e);
    }

    @ExceptionHandler(RoundCancelledException.class)
    public ResponseEntity<ErrorResponse> cancelled(RoundCancelledException e) {
        return error(HttpStatus.SERVICE_UNAVAILABLE, "ROUND_CANCELLED", e);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> badRequest(IllegalArgumentException e) {
        return error(HttpStatus.BAD_REQUEST, "BAD_REQUEST", e);
    }

    private static ResponseEntity<ErrorResponse> error(HttpStatus status, String code, RuntimeException e) {
        return ResponseEntity.status(status).body(new ErrorResponse(code, e.getMessage()));
    }
}
