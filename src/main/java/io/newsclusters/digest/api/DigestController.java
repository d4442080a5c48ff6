package io.newsclusters.digest.api;

import io.newsclusters.digest.api.dto.DigestRequest;
import io.newsclusters.digest.api.dto.DigestResult;
import io.newsclusters.digest.api.dto.UserPreferences;
import io.newsclusters.digest.api.service.DigestService;
import io.newsclusters.digest.api.service.NewsClusteringService;
import io.newsclusters.digest.api.service.UserPreferenceService;
import io.newsclusters.digest.config.DigestConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/api/v1/digest")
public class DigestController {

    private static final Logger logger = LoggerFactory.getLogger(DigestController.class);

    private final DigestService digestService;
    private final UserPreferenceService preferenceService;
    private final NewsClusteringService clusteringService;
    private final DigestConfig digestConfig;

    public DigestController(DigestService digestService,
                            UserPreferenceService preferenceService,
                            NewsClusteringService clusteringService,
                            DigestConfig digestConfig) {
        this.digestService = digestService;
        this.preferenceService = preferenceService;
        this.clusteringService = clusteringService;
        this.digestConfig = digestConfig;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of(
                "status", "UP",
                "service", "News Cluster Digest Service",
                "similarityEngine", clusteringService.engineName(),
                "timestamp", LocalDateTime.now()
        ));
    }

    @GetMapping
    public DigestResult previewDigest(@RequestParam String topic,
                                      @RequestParam(required = false) String location,
                                      @RequestParam(required = false) String language) {
        return digestService.buildDigest(
                topic,
                orDefault(location, digestConfig.feed().defaultRegion()),
                orDefault(language, digestConfig.feed().defaultLanguage())
        );
    }

    @PostMapping("/{chatId}")
    public ResponseEntity<Map<String, Object>> sendDigest(@PathVariable long chatId,
                                                          @RequestBody(required = false) DigestRequest request) {
        Optional<UserPreferences> saved = preferenceService.find(chatId);

        String topic = firstNonBlank(request != null ? request.topic() : null,
                saved.map(UserPreferences::topic).orElse(null));
        if (topic == null) {
            throw new IllegalArgumentException("No topic given and no saved preferences for chat " + chatId);
        }

        String location = firstNonBlank(request != null ? request.location() : null,
                saved.map(UserPreferences::location).orElse(null));
        String language = firstNonBlank(request != null ? request.language() : null,
                saved.map(UserPreferences::language).orElse(null));

        logger.debug("Digest requested for chat {} (topic='{}')", chatId, topic);

        int published = digestService.sendDigest(
                chatId,
                topic,
                orDefault(location, digestConfig.feed().defaultRegion()),
                orDefault(language, digestConfig.feed().defaultLanguage())
        );

        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of(
                "chatId", chatId,
                "messagesPublished", published
        ));
    }

    private static String firstNonBlank(String first, String second) {
        if (first != null && !first.isBlank()) return first;
        if (second != null && !second.isBlank()) return second;
        return null;
    }

    private static String orDefault(String value, String fallback) {
        return value != null && !value.isBlank() ? value : fallback;
    }
}
