package io.newsclusters.digest.api.service;

import io.newsclusters.digest.api.dto.UserPreferences;
import io.newsclusters.digest.api.dto.UserSubscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.*;

/**
 * Per-user digest preferences kept in Redis hashes, plus a set of users with daily updates.
 */
@Service
public class UserPreferenceService {
    private static final Logger logger = LoggerFactory.getLogger(UserPreferenceService.class);

    static final String USER_KEY_PREFIX = "digest:user:";
    static final String AUTOMATIC_USERS_KEY = "digest:users:automatic";

    private static final String TOPIC = "topic";
    private static final String LANGUAGE = "language";
    private static final String LOCATION = "location";
    private static final String AUTOMATIC = "automatic";
    private static final String UPDATED_AT = "updatedAt";

    private final RedisTemplate<String, String> redisTemplate;
    private final Clock clock;

    public UserPreferenceService(RedisTemplate<String, String> redisTemplate, Clock clock) {
        this.redisTemplate = redisTemplate;
        this.clock = clock;
    }

    public Optional<UserPreferences> find(long userId) {
        Map<String, String> fields = hashOps().entries(userKey(userId));
        if (fields == null || fields.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(toPreferences(fields));
    }

    public UserPreferences save(long userId, UserPreferences preferences) {
        if (preferences.topic() == null || preferences.topic().isBlank()) {
            throw new IllegalArgumentException("Topic must not be blank");
        }

        Map<String, String> fields = new HashMap<>();
        fields.put(TOPIC, preferences.topic().trim());
        fields.put(LANGUAGE, preferences.language());
        fields.put(LOCATION, preferences.location());
        fields.put(AUTOMATIC, String.valueOf(preferences.automatic()));
        fields.put(UPDATED_AT, Instant.now(clock).toString());

        hashOps().putAll(userKey(userId), fields);
        updateAutomaticMembership(userId, preferences.automatic());

        logger.info("Saved preferences for user {}", userId);
        return toPreferences(fields);
    }

    /**
     * @return false if the user has no stored preferences
     */
    public boolean updateAutomatic(long userId, boolean automatic) {
        String key = userKey(userId);
        if (!Boolean.TRUE.equals(redisTemplate.hasKey(key))) {
            logger.warn("User {} not found when updating automatic status", userId);
            return false;
        }

        hashOps().put(key, AUTOMATIC, String.valueOf(automatic));
        hashOps().put(key, UPDATED_AT, Instant.now(clock).toString());
        updateAutomaticMembership(userId, automatic);

        logger.info("Updated automatic status for user {}: {}", userId, automatic);
        return true;
    }

    /**
     * Users with daily updates enabled, most recently updated first.
     */
    public List<UserSubscription> findAutomaticSubscriptions() {
        Set<String> members = redisTemplate.opsForSet().members(AUTOMATIC_USERS_KEY);
        if (members == null || members.isEmpty()) {
            return List.of();
        }

        List<Map.Entry<Instant, UserSubscription>> subscriptions = new ArrayList<>();
        for (String member : members) {
            long userId;
            try {
                userId = Long.parseLong(member);
            } catch (NumberFormatException e) {
                logger.warn("Ignoring malformed user id in {}: {}", AUTOMATIC_USERS_KEY, member);
                continue;
            }

            Map<String, String> fields = hashOps().entries(userKey(userId));
            if (fields == null || fields.isEmpty()) {
                logger.warn("User {} listed for automatic updates has no preferences", userId);
                continue;
            }

            UserPreferences preferences = toPreferences(fields);
            if (!preferences.automatic()) {
                continue;
            }
            subscriptions.add(Map.entry(
                    parseUpdatedAt(fields.get(UPDATED_AT)),
                    new UserSubscription(userId, preferences.topic(), preferences.language(), preferences.location())
            ));
        }

        return subscriptions.stream()
                .sorted(Map.Entry.<Instant, UserSubscription>comparingByKey().reversed())
                .map(Map.Entry::getValue)
                .toList();
    }

    private void updateAutomaticMembership(long userId, boolean automatic) {
        if (automatic) {
            redisTemplate.opsForSet().add(AUTOMATIC_USERS_KEY, String.valueOf(userId));
        } else {
            redisTemplate.opsForSet().remove(AUTOMATIC_USERS_KEY, String.valueOf(userId));
        }
    }

    private HashOperations<String, String, String> hashOps() {
        return redisTemplate.opsForHash();
    }

    private static UserPreferences toPreferences(Map<String, String> fields) {
        return new UserPreferences(
                fields.get(TOPIC),
                fields.get(LANGUAGE),
                fields.get(LOCATION),
                Boolean.parseBoolean(fields.get(AUTOMATIC))
        );
    }

    private static Instant parseUpdatedAt(String value) {
        try {
            return value != null ? Instant.parse(value) : Instant.EPOCH;
        } catch (DateTimeParseException e) {
            return Instant.EPOCH;
        }
    }

    private static String userKey(long userId) {
        return USER_KEY_PREFIX + userId;
    }
}
