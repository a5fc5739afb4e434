package com.nosota.lingodesk.service;

import com.nosota.lingodesk.api.response.ApiKeyResponse;
import com.nosota.lingodesk.model.ApiKey;
import com.nosota.lingodesk.model.User;
import com.nosota.lingodesk.repository.ApiKeyRepository;
import com.nosota.lingodesk.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Issues and checks API keys for the {@code /api/v1} surface.
 * <p>
 * The plain key is returned once at creation. Only its SHA-256 digest is stored, so a
 * database leak does not reveal usable keys.
 * </p>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ApiKeyService {

    static final String KEY_PREFIX = "ld_";

    private final ApiKeyRepository apiKeyRepository;
    private final UserRepository userRepository;
    private final TokenGenerator tokenGenerator;
    private final Clock clock;

    @Transactional
    public ApiKeyResponse createKey(User user, String name) {
        String rawKey = KEY_PREFIX + tokenGenerator.hexToken(24);

        ApiKey apiKey = new ApiKey();
        apiKey.setUserId(user.getId());
        apiKey.setName(StringUtils.hasText(name) ? name.trim() : "API key");
        apiKey.setKeyDigest(digest(rawKey));
        apiKey.setCreatedAt(LocalDateTime.now(clock));
        apiKey = apiKeyRepository.save(apiKey);

        log.info("API key created: id={}, userId={}", apiKey.getId(), user.getId());
        return new ApiKeyResponse(apiKey.getId(), apiKey.getName(), rawKey, apiKey.getCreatedAt());
    }

    /**
     * Resolves a presented key to its owner and records the time of use.
     *
     * @param rawKey key as sent by the client
     * @return the owning user, empty if the key is unknown
     */
    @Transactional
    public Optional<User> authenticate(String rawKey) {
        if (!StringUtils.hasText(rawKey)) {
            return Optional.empty();
        }
        return apiKeyRepository.findByKeyDigest(digest(rawKey))
                .flatMap(apiKey -> {
                    apiKey.setLastUsedAt(LocalDateTime.now(clock));
                    return userRepository.findById(apiKey.getUserId());
                });
    }

    static String digest(String rawKey) {
        return DigestUtils.sha256Hex(rawKey);
    }
}
