package com.bluecodes.storefront.contact.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;

public record ContactRequest(
        @NotBlank(message = "email is required")
        @Email(message = "email must be a valid address")
        String email,

        @NotBlank(message = "subject is required")
        String subject,

        @NotBlank(message = "message is required")
        String message
) {}
