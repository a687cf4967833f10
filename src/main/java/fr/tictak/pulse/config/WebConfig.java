package fr.tictak.pulse.config;

import fr.tictak.pulse.model.enums.DigestType;
import fr.tictak.pulse.model.enums.NotificationType;
import fr.tictak.pulse.model.enums.SourceType;
import org.springframework.context.annotation.Configuration;
import org.springframework.format.FormatterRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Path and query enums use the lowercase wire values ({@code task_due_soon}, {@code weekly}).
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    @Override
    public void addFormatters(FormatterRegistry registry) {
        registry.addConverter(String.class, NotificationType.class, NotificationType::fromValue);
        registry.addConverter(String.class, DigestType.class, DigestType::fromValue);
        registry.addConverter(String.class, SourceType.class, SourceType::fromValue);
    }
}
