package com.example.wormhole.service;

import com.example.wormhole.TestFixtures;
import com.example.wormhole.TestFixtures.MutableClock;
import com.example.wormhole.client.TicketClient;
import com.example.wormhole.client.TicketFilingException;
import com.example.wormhole.model.FieldError;
import com.example.wormhole.model.SubmissionRequest;
import com.example.wormhole.model.SubmissionResponse;
import com.example.wormhole.model.Ticket;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class SubmissionServiceTest {

    private static final String CHANNEL_ID = "UCabcdefghijklmnopqrstuv";

    private static ValidatorFactory validatorFactory;
    private static Validator validator;

    private TicketClient ticketClient;
    private MutableClock clock;
    private SubmissionService service;

    @BeforeAll
    static void createValidator() {
        validatorFactory = Validation.buildDefaultValidatorFactory();
        validator = validatorFactory.getValidator();
    }

    @AfterAll
    static void closeValidator() {
        validatorFactory.close();
    }

    @BeforeEach
    void setUp() {
        ticketClient = mock(TicketClient.class);
        when(ticketClient.fileTicket(anyString(), anyString(), anyList()))
                .thenReturn(new Ticket(17, "https://github.com/owner/repo/issues/17"));
        clock = new MutableClock(TestFixtures.NOW);
        SubmissionThrottle throttle = new SubmissionThrottle(
                TestFixtures.properties(Path.of("unused"), 100, 3, Duration.ofHours(1)), clock);
        service = new SubmissionService(validator, throttle, ticketClient);
    }

    @Test
    void validSubmissionFilesTicket() {
        SubmissionResponse response = service.submit(
                new SubmissionRequest("12345", CHANNEL_ID, "fan@example.com", "Same avatar on both"), "1.2.3.4");

        assertTrue(response.success());
        assertEquals(17, response.issueNumber());
        assertEquals("https://github.com/owner/repo/issues/17", response.issueUrl());
        assertEquals("Submission received. Verification will be processed automatically.", response.message());
        verify(ticketClient).fileTicket(eq("User Mapping: 12345 -> " + CHANNEL_ID), anyString(),
                eq(List.of("user-mapping", "pending-verification")));
    }

    @Test
    void malformedIdsAreRejectedWithoutFilingTicket() {
        SubmissionValidationException error = assertThrows(SubmissionValidationException.class,
                () -> service.submit(new SubmissionRequest("abc", "xyz", null, null), "1.2.3.4"));

        assertEquals(List.of(
                new FieldError("bilibiliUid", "Invalid Bilibili UID"),
                new FieldError("youtubeChannelId", "Invalid YouTube Channel ID")), error.errors());
        verifyNoInteractions(ticketClient);
    }

    @Test
    void missingFieldsReportOneErrorPerField() {
        SubmissionValidationException error = assertThrows(SubmissionValidationException.class,
                () -> service.submit(new SubmissionRequest(null, "", null, null), "1.2.3.4"));

        assertEquals(List.of("bilibiliUid", "youtubeChannelId"),
                error.errors().stream().map(FieldError::field).toList());
    }

    @Test
    void optionalFieldsAreChecked() {
        SubmissionValidationException error = assertThrows(SubmissionValidationException.class,
                () -> service.submit(new SubmissionRequest("12345", CHANNEL_ID, "not-an-email", "x".repeat(501)),
                        "1.2.3.4"));

        assertEquals(List.of("notes", "submitterEmail"),
                error.errors().stream().map(FieldError::field).toList());
    }

    @Test
    void channelIdMustBeExactlyTwentyFourCharacters() {
        assertThrows(SubmissionValidationException.class,
                () -> service.submit(new SubmissionRequest("12345", CHANNEL_ID + "x", null, null), "1.2.3.4"));
        assertDoesNotThrow(
                () -> service.submit(new SubmissionRequest("12345", "UC-_abcdefghijklmnopqrst", null, null), "1.2.3.4"));
    }

    @Test
    void rateLimitAppliesPerClientAndWindow() {
        SubmissionRequest request = new SubmissionRequest("12345", CHANNEL_ID, null, null);
        for (int i = 0; i < 3; i++) {
            service.submit(request, "1.2.3.4");
        }

        assertThrows(SubmissionRateLimitException.class, () -> service.submit(request, "1.2.3.4"));
        assertDoesNotThrow(() -> service.submit(request, "5.6.7.8"));

        clock.advance(Duration.ofHours(1));
        assertDoesNotThrow(() -> service.submit(request, "1.2.3.4"));
    }

    @Test
    void rateLimitIsCheckedBeforeValidation() {
        SubmissionRequest invalid = new SubmissionRequest("abc", CHANNEL_ID, null, null);
        for (int i = 0; i < 3; i++) {
            assertThrows(SubmissionValidationException.class, () -> service.submit(invalid, "1.2.3.4"));
        }

        assertThrows(SubmissionRateLimitException.class, () -> service.submit(invalid, "1.2.3.4"));
    }

    @Test
    void ticketFailurePropagates() {
        when(ticketClient.fileTicket(anyString(), anyString(), any()))
                .thenThrow(new TicketFilingException("GitHub unavailable", null));

        assertThrows(TicketFilingException.class,
                () -> service.submit(new SubmissionRequest("12345", CHANNEL_ID, null, null), "1.2.3.4"));
    }

    @Test
    void ticketBodyListsOptionalFieldsOnlyWhenPresent() {
        String bare = SubmissionService.ticketBody(new SubmissionRequest("12345", CHANNEL_ID, null, " "));
        String full = SubmissionService.ticketBody(new SubmissionRequest("12345", CHANNEL_ID, "fan@example.com", "hi"));

        assertTrue(bare.contains("**Bilibili UID**: 12345"));
        assertTrue(bare.contains("**YouTube Channel ID**: " + CHANNEL_ID));
        assertFalse(bare.contains("Submitter Email"));
        assertFalse(bare.contains("### Notes"));
        assertTrue(full.contains("**Submitter Email**: fan@example.com"));
        assertTrue(full.contains("### Notes\nhi"));
    }
}
