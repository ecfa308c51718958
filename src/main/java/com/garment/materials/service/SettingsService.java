package com.garment.materials.service;

import com.garment.materials.model.AppSetting;
import com.garment.materials.repository.AppSettingRepository;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Service
public class SettingsService {

    public static final String KEY_ALLOW_EXCESS_WASTE = "allow_excess_waste";

    private final AppSettingRepository appSettingRepository;

    public SettingsService(AppSettingRepository appSettingRepository) {
        this.appSettingRepository = appSettingRepository;
    }

    /**
     * Whether BOM lines may carry more than 100% waste (more scrap than usable material).
     */
    public boolean isExcessWasteAllowed() {
        return appSettingRepository.findBySettingKey(KEY_ALLOW_EXCESS_WASTE)
                .map(AppSetting::getSettingValue)
                .map(Boolean::parseBoolean)
                .orElse(false);
    }

    public Optional<String> getSetting(String key) {
        return appSettingRepository.findBySettingKey(key).map(AppSetting::getSettingValue);
    }

    public void updateSetting(String key, String value) {
        Optional<AppSetting> existing = appSettingRepository.findBySettingKey(key);
        AppSetting setting = existing.orElseGet(() -> new AppSetting(key, ""));
        setting.setSettingValue(value != null ? value : "");
        appSettingRepository.save(setting);
    }
}
