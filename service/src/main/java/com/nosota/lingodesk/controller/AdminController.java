package com.nosota.lingodesk.controller;

import com.nosota.lingodesk.api.AdminApi;
import com.nosota.lingodesk.api.model.CreditTransactionType;
import com.nosota.lingodesk.api.model.UserRole;
import com.nosota.lingodesk.api.request.*;
import com.nosota.lingodesk.api.response.*;
import com.nosota.lingodesk.mapper.AccountMapper;
import com.nosota.lingodesk.mapper.CreditTransactionMapper;
import com.nosota.lingodesk.mapper.UserMapper;
import com.nosota.lingodesk.model.User;
import com.nosota.lingodesk.security.CurrentUserProvider;
import com.nosota.lingodesk.service.AccountService;
import com.nosota.lingodesk.service.CreditService;
import com.nosota.lingodesk.service.TeamService;
import com.nosota.lingodesk.service.UserManagementService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for administrators: teams, users of the own account and credit balances.
 *
 * <p>The security chain already restricts {@code /api/admin/**} to the admin role held at login.
 * The role is checked again against the database here, so a demotion takes effect immediately.
 */
@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class AdminController implements AdminApi {

    private final TeamService teamService;
    private final UserManagementService userManagementService;
    private final AccountService accountService;
    private final CreditService creditService;
    private final CurrentUserProvider currentUserProvider;

    @Override
    public ResponseEntity<List<TeamResponse>> listTeams() {
        requireAdmin();
        return ResponseEntity.ok(AccountMapper.INSTANCE.toTeamResponseList(teamService.listTeams()));
    }

    @Override
    public ResponseEntity<TeamResponse> getTeam(Long teamId) {
        requireAdmin();
        return ResponseEntity.ok(AccountMapper.INSTANCE.toResponse(teamService.getTeam(teamId)));
    }

    @Override
    public ResponseEntity<TeamResponse> createTeam(CreateTeamRequest request) {
        requireAdmin();
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(AccountMapper.INSTANCE.toResponse(teamService.createTeam(request)));
    }

    @Override
    public ResponseEntity<TeamResponse> updateTeam(Long teamId, UpdateTeamRequest request) {
        requireAdmin();
        return ResponseEntity.ok(AccountMapper.INSTANCE.toResponse(teamService.updateTeam(teamId, request)));
    }

    @Override
    public ResponseEntity<MessageResponse> deleteTeam(Long teamId) {
        requireAdmin();
        teamService.deleteTeam(teamId);
        return ResponseEntity.ok(new MessageResponse("Team deleted successfully"));
    }

    @Override
    public ResponseEntity<List<UserResponse>> listTeamUsers(Long teamId) {
        requireAdmin();
        return ResponseEntity.ok(UserMapper.INSTANCE.toResponseList(teamService.listTeamUsers(teamId)));
    }

    @Override
    public ResponseEntity<CreditsAddedResponse> addTeamCredits(Long teamId, AddCreditsRequest request) {
        User admin = requireAdmin();
        long balance = creditService.addTeamCredits(teamId, request.amount(), CreditTransactionType.ADMIN_ADJUSTMENT,
                descriptionOrDefault(request), admin.getId());
        return ResponseEntity.ok(new CreditsAddedResponse("Credits added successfully", request.amount(), balance));
    }

    @Override
    public ResponseEntity<List<UserResponse>> listUsers() {
        User admin = requireAdmin();
        return ResponseEntity.ok(UserMapper.INSTANCE.toResponseList(userManagementService.listUsers(admin)));
    }

    @Override
    public ResponseEntity<UserResponse> createUser(CreateUserRequest request) {
        User admin = requireAdmin();
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(UserMapper.INSTANCE.toResponse(userManagementService.createUser(admin, request)));
    }

    @Override
    public ResponseEntity<UserResponse> updateUser(Long userId, UpdateUserRequest request) {
        User admin = requireAdmin();
        return ResponseEntity.ok(UserMapper.INSTANCE.toResponse(userManagementService.updateUser(admin, userId, request)));
    }

    @Override
    public ResponseEntity<MessageResponse> deleteUser(Long userId) {
        User admin = requireAdmin();
        userManagementService.deleteUser(admin, userId);
        return ResponseEntity.ok(new MessageResponse("User deleted successfully"));
    }

    @Override
    public ResponseEntity<AccountResponse> getAccount() {
        User admin = requireAdmin();
        return ResponseEntity.ok(accountService.getAccount(admin.getAccountId()));
    }

    @Override
    public ResponseEntity<List<CreditTransactionResponse>> listCreditTransactions() {
        User admin = requireAdmin();
        return ResponseEntity.ok(CreditTransactionMapper.INSTANCE.toResponseList(
                creditService.getAccountTransactions(admin.getAccountId())));
    }

    @Override
    public ResponseEntity<CreditsAddedResponse> addCredits(AddCreditsRequest request) {
        User admin = requireAdmin();
        long balance = creditService.addAccountCredits(admin.getAccountId(), request.amount(),
                CreditTransactionType.ADMIN_ADJUSTMENT, descriptionOrDefault(request), admin.getId());
        return ResponseEntity.ok(new CreditsAddedResponse("Credits added successfully", request.amount(), balance));
    }

    private User requireAdmin() {
        User user = currentUserProvider.requireUser();
        if (user.getRole() != UserRole.ADMIN) {
            throw new AccessDeniedException("Admin access required");
        }
        return user;
    }

    private static String descriptionOrDefault(AddCreditsRequest request) {
        return StringUtils.hasText(request.description()) ? request.description().trim() : "Admin credit adjustment";
    }
}
