package com.fieldservice.backend.config;

import com.fieldservice.backend.auth.UserRepository;
import com.fieldservice.backend.auth.UserService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Seeds one administrator account at startup when
 * security.bootstrap-admin.login and .password are both set.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BootstrapAdminInitializer implements ApplicationRunner {

    static final String ADMIN_ROLE = "admin";

    private final SecurityProperties properties;
    private final UserRepository     userRepository;
    private final UserService        userService;

    @Override
    public void run(ApplicationArguments args) {
        SecurityProperties.BootstrapAdmin admin = properties.getBootstrapAdmin();
        if (isBlank(admin.getLogin()) || isBlank(admin.getPassword())) {
            log.debug("No bootstrap administrator configured");
            return;
        }
        if (userRepository.existsByLogin(admin.getLogin())) {
            log.info("Bootstrap administrator '{}' already exists", admin.getLogin());
            return;
        }
        userService.createUser(admin.getLogin(), admin.getPassword(), ADMIN_ROLE, ADMIN_ROLE);
        log.info("Bootstrap administrator '{}' created", admin.getLogin());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
