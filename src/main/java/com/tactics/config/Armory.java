package com.tactics.config;

import com.tactics.exception.ConfigurationException;
import com.tactics.model.WeaponProfile;
import jakarta.annotation.PostConstruct;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Weapon profiles of every faction, loaded from {@code classpath:armory/*.json}.
 * <p>
 * Lookups are strict: an unknown weapon code is a configuration error, never a default.
 */
@Component
@Slf4j
public class Armory {

    private final ObjectMapper objectMapper;
    private final Validator validator;

    private final Map<String, WeaponProfile> weapons = new LinkedHashMap<>();

    public Armory(ObjectMapper objectMapper, Validator validator) {
        this.objectMapper = objectMapper;
        this.validator = validator;
    }

    @PostConstruct
    public void loadArmory() {
        try {
            var resolver = new PathMatchingResourcePatternResolver();
            Resource[] resources = resolver.getResources("classpath:armory/*.json");

            for (Resource resource : resources) {
                try (InputStream is = resource.getInputStream()) {
                    registerArmory(objectMapper.readValue(is, ArmoryDefinition.class), resource.getFilename());
                }
            }
        } catch (IOException | JacksonException e) {
            throw new ConfigurationException("Could not load armory files", e);
        }
    }

    /**
     * Add every weapon of one armory file.
     *
     * @throws ConfigurationException if the file has no weapons or any of them is invalid
     */
    public void registerArmory(ArmoryDefinition armory, String source) {
        if (armory == null) {
            throw new ConfigurationException("Armory file " + source + " is empty");
        }
        validate(armory, "armory file " + source);
        armory.weapons().forEach(this::register);
        log.info("Loaded {} weapon(s) for faction '{}' from {}", armory.weapons().size(), armory.faction(), source);
    }

    /**
     * Add a weapon definition. Invalid profiles and duplicate codes are rejected.
     */
    public void register(WeaponDefinition definition) {
        validate(definition, "weapon '" + definition.code() + "'");
        if (weapons.containsKey(definition.code())) {
            throw new ConfigurationException("Duplicate weapon code in armory: " + definition.code());
        }
        int range = definition.isMelee() ? 1 : definition.range();
        String name = definition.displayName() != null ? definition.displayName() : definition.code();
        weapons.put(definition.code(), new WeaponProfile(definition.code(), name, range,
                definition.attacks(), definition.accuracy(), definition.strength(),
                definition.armorPenetration(), definition.damage()));
    }

    /**
     * Get a weapon by its code.
     *
     * @throws ConfigurationException if the code is unknown
     */
    public WeaponProfile getWeapon(String code) {
        WeaponProfile weapon = weapons.get(code);
        if (weapon == null) {
            throw new ConfigurationException("Unknown weapon: " + code
                    + ". Available weapons: " + weapons.keySet());
        }
        return weapon;
    }

    public Map<String, WeaponProfile> getWeapons() {
        return Collections.unmodifiableMap(weapons);
    }

    private <T> void validate(T definition, String what) {
        Set<ConstraintViolation<T>> violations = validator.validate(definition);
        if (!violations.isEmpty()) {
            String details = violations.stream()
                    .map(v -> v.getPropertyPath() + " " + v.getMessage())
                    .sorted()
                    .collect(Collectors.joining("; "));
            throw new ConfigurationException("Invalid " + what + ": " + details);
        }
    }
}
