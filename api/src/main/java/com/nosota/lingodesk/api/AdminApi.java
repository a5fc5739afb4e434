package com.nosota.lingodesk.api;

import com.nosota.lingodesk.api.request.AddCreditsRequest;
import com.nosota.lingodesk.api.request.CreateTeamRequest;
import com.nosota.lingodesk.api.request.CreateUserRequest;
import com.nosota.lingodesk.api.request.UpdateTeamRequest;
import com.nosota.lingodesk.api.request.UpdateUserRequest;
import com.nosota.lingodesk.api.response.AccountResponse;
import com.nosota.lingodesk.api.response.CreditTransactionResponse;
import com.nosota.lingodesk.api.response.CreditsAddedResponse;
import com.nosota.lingodesk.api.response.MessageResponse;
import com.nosota.lingodesk.api.response.TeamResponse;
import com.nosota.lingodesk.api.response.UserResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;

import java.util.List;

/**
 * Administration API. All routes require the {@code admin} role.
 *
 * <p>Covers:
 * <ul>
 *   <li>Teams: CRUD, member listing, credit top-up</li>
 *   <li>Users of the administrator's account: CRUD</li>
 *   <li>Account: details, credit ledger, credit top-up</li>
 * </ul>
 */
@RequestMapping("/api/admin")
public interface AdminApi {

    // ==================== Teams ====================

    @GetMapping("/teams")
    ResponseEntity<List<TeamResponse>> listTeams();

    @GetMapping("/teams/{teamId}")
    ResponseEntity<TeamResponse> getTeam(@PathVariable("teamId") Long teamId);

    @PostMapping("/teams")
    ResponseEntity<TeamResponse> createTeam(@RequestBody @Valid CreateTeamRequest request);

    @PatchMapping("/teams/{teamId}")
    ResponseEntity<TeamResponse> updateTeam(@PathVariable("teamId") Long teamId,
                                            @RequestBody @Valid UpdateTeamRequest request);

    /**
     * Deletes a team. Rejected with 409 while any user is assigned to it.
     */
    @DeleteMapping("/teams/{teamId}")
    ResponseEntity<MessageResponse> deleteTeam(@PathVariable("teamId") Long teamId);

    @GetMapping("/teams/{teamId}/users")
    ResponseEntity<List<UserResponse>> listTeamUsers(@PathVariable("teamId") Long teamId);

    /**
     * Adds credits to a team and records an {@code admin_adjustment} ledger entry.
     */
    @PostMapping("/teams/{teamId}/credits")
    ResponseEntity<CreditsAddedResponse> addTeamCredits(@PathVariable("teamId") Long teamId,
                                                        @RequestBody @Valid AddCreditsRequest request);

    // ==================== Users ====================

    @GetMapping("/users")
    ResponseEntity<List<UserResponse>> listUsers();

    /**
     * Creates a user in the administrator's account.
     *
     * @return 201 with the user; 409 if the e-mail or username is taken
     */
    @PostMapping("/users")
    ResponseEntity<UserResponse> createUser(@RequestBody @Valid CreateUserRequest request);

    /**
     * Updates a user of the administrator's account. An administrator cannot change
     * their own role.
     */
    @PatchMapping("/users/{userId}")
    ResponseEntity<UserResponse> updateUser(@PathVariable("userId") Long userId,
                                            @RequestBody @Valid UpdateUserRequest request);

    @DeleteMapping("/users/{userId}")
    ResponseEntity<MessageResponse> deleteUser(@PathVariable("userId") Long userId);

    // ==================== Account ====================

    @GetMapping("/account")
    ResponseEntity<AccountResponse> getAccount();

    /**
     * Ledger of the administrator's account, newest first.
     */
    @GetMapping("/credit-transactions")
    ResponseEntity<List<CreditTransactionResponse>> listCreditTransactions();

    /**
     * Adds credits to the administrator's account and records an {@code admin_adjustment}
     * ledger entry in the same transaction.
     */
    @PostMapping("/credits")
    ResponseEntity<CreditsAddedResponse> addCredits(@RequestBody @Valid AddCreditsRequest request);
}
