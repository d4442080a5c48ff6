package io.newsclusters.digest.api;

import io.newsclusters.digest.api.dto.UserPreferences;
import io.newsclusters.digest.api.service.UserPreferenceService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/users/{userId}/preferences")
public class PreferencesController {

    private final UserPreferenceService preferenceService;

    public PreferencesController(UserPreferenceService preferenceService) {
        this.preferenceService = preferenceService;
    }

    @GetMapping
    public ResponseEntity<UserPreferences> getPreferences(@PathVariable long userId) {
        return preferenceService.find(userId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @PutMapping
    public UserPreferences savePreferences(@PathVariable long userId, @RequestBody UserPreferences preferences) {
        return preferenceService.save(userId, preferences);
    }

    @PostMapping("/automatic/toggle")
    public ResponseEntity<Map<String, Object>> toggleAutomatic(@PathVariable long userId) {
        var preferences = preferenceService.find(userId);
        if (preferences.isEmpty()) {
            return ResponseEntity.notFound().build();
        }

        boolean enabled = !preferences.get().automatic();
        preferenceService.updateAutomatic(userId, enabled);

        return ResponseEntity.ok(Map.of(
                "userId", userId,
                "automatic", enabled
        ));
    }
}
