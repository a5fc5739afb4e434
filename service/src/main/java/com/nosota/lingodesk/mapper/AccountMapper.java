package com.nosota.lingodesk.mapper;

import com.nosota.lingodesk.api.response.AccountResponse;
import com.nosota.lingodesk.api.response.TeamResponse;
import com.nosota.lingodesk.model.Account;
import com.nosota.lingodesk.model.Team;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.factory.Mappers;

import java.util.List;

@Mapper
public interface AccountMapper {

    AccountMapper INSTANCE = Mappers.getMapper(AccountMapper.class);

    /**
     * @param account    account entity
     * @param usersCount number of users belonging to the account
     */
    @Mapping(target = "usersCount", source = "usersCount")
    AccountResponse toResponse(Account account, long usersCount);

    TeamResponse toResponse(Team team);

    List<TeamResponse> toTeamResponseList(List<Team> teams);
}
