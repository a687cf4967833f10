package fr.tictak.pulse.config;

import com.google.auth.oauth2.GoogleCredentials;
import com.google.firebase.FirebaseApp;
import com.google.firebase.FirebaseOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;

/**
 * Firebase app backing the push channel. The credentials location accepts any Spring resource prefix
 * ({@code classpath:}, {@code file:}); a bare path is looked up on the classpath.
 */
@Configuration
@ConditionalOnProperty(name = "pulse.channels.push.enabled", havingValue = "true")
public class FirebaseConfig {

    private static final Logger logger = LoggerFactory.getLogger(FirebaseConfig.class);

    @Bean
    public FirebaseApp firebaseApp(PulseProperties properties, ResourceLoader resourceLoader) throws IOException {
        if (!FirebaseApp.getApps().isEmpty()) {
            FirebaseApp existing = FirebaseApp.getApps().get(0);
            logger.info("Reusing FirebaseApp {}", existing.getName());
            return existing;
        }

        String location = properties.getChannels().getPush().getCredentialsFile();
        Resource credentials = resourceLoader.getResource(location.contains(":") ? location : "classpath:" + location);
        if (!credentials.exists()) {
            throw new IllegalStateException("Push is enabled but Firebase credentials are missing: " + location);
        }

        try (InputStream in = credentials.getInputStream()) {
            FirebaseOptions options = FirebaseOptions.builder()
                    .setCredentials(GoogleCredentials.fromStream(in))
                    .build();
            FirebaseApp app = FirebaseApp.initializeApp(options);
            logger.info("FirebaseApp {} initialised from {}", app.getName(), credentials.getDescription());
            return app;
        }
    }
}
