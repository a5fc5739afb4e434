package com.nosota.lingodesk.service;

import com.nosota.lingodesk.api.model.SubscriptionPlan;
import com.nosota.lingodesk.api.model.SubscriptionStatus;
import com.nosota.lingodesk.api.request.CreateTeamRequest;
import com.nosota.lingodesk.api.request.UpdateTeamRequest;
import com.nosota.lingodesk.error.ResourceNotFoundException;
import com.nosota.lingodesk.error.TeamNotEmptyException;
import com.nosota.lingodesk.model.Team;
import com.nosota.lingodesk.model.User;
import com.nosota.lingodesk.repository.TeamRepository;
import com.nosota.lingodesk.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Team administration.
 * <p>
 * A team cannot be deleted while users are assigned to it. The check and the delete run in one
 * transaction with the team row locked.
 * </p>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TeamService {

    private final TeamRepository teamRepository;
    private final UserRepository userRepository;
    private final Clock clock;

    @Transactional(readOnly = true)
    public List<Team> listTeams() {
        return teamRepository.findAllByOrderByCreatedAtDescIdDesc();
    }

    @Transactional(readOnly = true)
    public Team getTeam(Long teamId) {
        return teamRepository.findById(teamId)
                .orElseThrow(() -> new ResourceNotFoundException("Team", teamId));
    }

    @Transactional
    public Team createTeam(CreateTeamRequest request) {
        LocalDateTime now = LocalDateTime.now(clock);
        Team team = new Team();
        team.setName(request.name().trim());
        team.setDescription(request.description());
        team.setBillingEmail(request.billingEmail());
        team.setCredits(0L);
        team.setSubscriptionPlan(SubscriptionPlan.FREE);
        team.setSubscriptionStatus(SubscriptionStatus.ACTIVE);
        team.setCreatedAt(now);
        team.setUpdatedAt(now);
        team = teamRepository.save(team);
        log.info("Team created: teamId={}", team.getId());
        return team;
    }

    @Transactional
    public Team updateTeam(Long teamId, UpdateTeamRequest request) {
        Team team = getTeam(teamId);
        if (request.name() != null) {
            team.setName(request.name().trim());
        }
        if (request.description() != null) {
            team.setDescription(request.description());
        }
        if (request.billingEmail() != null) {
            team.setBillingEmail(request.billingEmail().isBlank() ? null : request.billingEmail());
        }
        team.setUpdatedAt(LocalDateTime.now(clock));
        log.info("Team updated: teamId={}", teamId);
        return teamRepository.save(team);
    }

    /**
     * @throws TeamNotEmptyException if any user is still assigned to the team
     */
    @Transactional
    public void deleteTeam(Long teamId) {
        Team team = teamRepository.getOneForUpdate(teamId)
                .orElseThrow(() -> new ResourceNotFoundException("Team", teamId));

        long members = userRepository.countByTeamId(teamId);
        if (members > 0) {
            throw new TeamNotEmptyException(teamId, members);
        }
        teamRepository.delete(team);
        log.info("Team deleted: teamId={}", teamId);
    }

    @Transactional(readOnly = true)
    public List<User> listTeamUsers(Long teamId) {
        getTeam(teamId);
        return userRepository.findByTeamIdOrderByCreatedAtDescIdDesc(teamId);
    }
}
