package com.example.wormhole.service;

import com.example.wormhole.client.TicketClient;
import com.example.wormhole.model.FieldError;
import com.example.wormhole.model.SubmissionRequest;
import com.example.wormhole.model.SubmissionResponse;
import com.example.wormhole.model.Ticket;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Turns a user-submitted pair into a verification ticket.
 * <p>
 * Order of checks: rate limit, then field validation, then ticket filing.
 */
@Service
public class SubmissionService {

    private static final Logger log = LoggerFactory.getLogger(SubmissionService.class);

    static final List<String> TICKET_LABELS = List.of("user-mapping", "pending-verification");

    private final Validator validator;
    private final SubmissionThrottle throttle;
    private final TicketClient ticketClient;

    public SubmissionService(Validator validator, SubmissionThrottle throttle, TicketClient ticketClient) {
        this.validator = validator;
        this.throttle = throttle;
        this.ticketClient = ticketClient;
    }

    /**
     * @throws SubmissionRateLimitException  when the client is over its allowance
     * @throws SubmissionValidationException when a field is malformed
     * @throws com.example.wormhole.client.TicketFilingException when the ticket cannot be created
     */
    public SubmissionResponse submit(SubmissionRequest request, String clientKey) {
        if (!throttle.tryAcquire(clientKey)) {
            log.info("Submission from {} rejected: rate limit", clientKey);
            throw new SubmissionRateLimitException(clientKey);
        }

        List<FieldError> errors = validate(request);
        if (!errors.isEmpty()) {
            throw new SubmissionValidationException(errors);
        }

        Ticket ticket = ticketClient.fileTicket(
                "User Mapping: %s -> %s".formatted(request.bilibiliUid(), request.youtubeChannelId()),
                ticketBody(request),
                TICKET_LABELS);
        log.info("Submission {} -> {} filed as #{}", request.bilibiliUid(), request.youtubeChannelId(), ticket.number());

        return new SubmissionResponse(true,
                "Submission received. Verification will be processed automatically.",
                ticket.url(), ticket.number());
    }

    List<FieldError> validate(SubmissionRequest request) {
        Set<ConstraintViolation<SubmissionRequest>> violations = validator.validate(request);
        return violations.stream()
                .map(v -> new FieldError(v.getPropertyPath().toString(), v.getMessage()))
                .distinct()
                .sorted(Comparator.comparing(FieldError::field).thenComparing(FieldError::message))
                .toList();
    }

    static String ticketBody(SubmissionRequest request) {
        StringBuilder body = new StringBuilder()
                .append("## User Mapping Submission\n\n")
                .append("**Bilibili UID**: ").append(request.bilibiliUid()).append('\n')
                .append("**YouTube Channel ID**: ").append(request.youtubeChannelId()).append('\n');
        if (request.submitterEmail() != null && !request.submitterEmail().isBlank()) {
            body.append("\n**Submitter Email**: ").append(request.submitterEmail()).append('\n');
        }
        if (request.notes() != null && !request.notes().isBlank()) {
            body.append("\n### Notes\n").append(request.notes()).append('\n');
        }
        body.append("\n---\n\n")
                .append("*This issue was automatically created by the submission system.*\n")
                .append("*The verification workflow will run automatically to validate this mapping.*");
        return body.toString();
    }
}
