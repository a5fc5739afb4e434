package com.nosota.lingodesk.api.request;

import com.nosota.lingodesk.api.model.UserRole;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

/**
 * Partial update of a user by an administrator. Null fields are left unchanged.
 *
 * @param teamId Team to assign; {@code 0} removes the user from its team
 */
public record UpdateUserRequest(
        @Size(min = 1, message = "First name must not be empty")
        String firstName,

        @Size(min = 1, message = "Last name must not be empty")
        String lastName,

        @Email(message = "Invalid email address")
        String email,

        @Size(min = 3, message = "Username must be at least 3 characters")
        String username,

        @Size(min = 8, message = "Password must be at least 8 characters")
        String password,

        UserRole role,

        @PositiveOrZero(message = "Team ID must not be negative")
        Long teamId,

        String jobTitle,

        String phoneNumber
) {
}
