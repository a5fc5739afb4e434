package com.nosota.lingodesk.mapper;

import com.nosota.lingodesk.api.response.UserResponse;
import com.nosota.lingodesk.model.User;
import org.mapstruct.Mapper;
import org.mapstruct.factory.Mappers;

import java.util.List;

/**
 * User entity to public view. Password hash, tokens and the TOTP secret have no target
 * property and are never exposed.
 */
@Mapper
public interface UserMapper {

    UserMapper INSTANCE = Mappers.getMapper(UserMapper.class);

    UserResponse toResponse(User user);

    List<UserResponse> toResponseList(List<User> users);
}
