package com.nosota.lingodesk.api.request;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Self-service registration. Creates a new account and its first user.
 *
 * @param firstName   First name
 * @param lastName    Last name
 * @param email       Login e-mail, must be unique
 * @param username    Display/login name, must be unique
 * @param password    Plain password (at least 8 characters), stored hashed
 * @param accountName Name of the account created for this user
 * @param jobTitle    Optional job title
 * @param phoneNumber Optional phone number
 */
public record RegisterRequest(
        @NotBlank(message = "First name is required")
        String firstName,

        @NotBlank(message = "Last name is required")
        String lastName,

        @NotBlank(message = "Email is required")
        @Email(message = "Invalid email address")
        String email,

        @NotBlank(message = "Username is required")
        @Size(min = 3, message = "Username must be at least 3 characters")
        String username,

        @NotBlank(message = "Password is required")
        @Size(min = 8, message = "Password must be at least 8 characters")
        String password,

        @NotBlank(message = "Account name is required")
        String accountName,

        String jobTitle,

        String phoneNumber
) {
}
