package com.example.wormhole.model;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * User-submitted pair awaiting verification.
 */
public record SubmissionRequest(
        @NotBlank(message = "Invalid Bilibili UID")
        @Pattern(regexp = "^\\d+$", message = "Invalid Bilibili UID")
        String bilibiliUid,

        @NotBlank(message = "Invalid YouTube Channel ID")
        @Pattern(regexp = "^UC[\\w-]{22}$", message = "Invalid YouTube Channel ID")
        String youtubeChannelId,

        @Email(message = "Invalid email")
        String submitterEmail,

        @Size(max = 500, message = "Notes must be at most 500 characters")
        String notes
) {}
