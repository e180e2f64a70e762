package io.petfeeder.backend.settings;

import io.petfeeder.backend.settings.dto.UpdateSettingRequest;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/config")
public class FeederSettingsController {

  private final FeederSettingsService settingsService;

  public FeederSettingsController(FeederSettingsService settingsService) {
    this.settingsService = settingsService;
  }

  @GetMapping("/{key}")
  public ResponseEntity<FeederSetting> getSetting(@PathVariable String key) {
    return ResponseEntity.ok(settingsService.get(key));
  }

  @PutMapping("/{key}")
  public ResponseEntity<FeederSetting> updateSetting(
      @PathVariable String key, @Valid @RequestBody UpdateSettingRequest request) {
    return ResponseEntity.ok(settingsService.update(key, request.value()));
  }
}
