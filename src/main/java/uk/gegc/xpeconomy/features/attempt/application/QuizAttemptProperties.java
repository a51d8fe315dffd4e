package uk.gegc.xpeconomy.features.attempt.application;

import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "xp.quiz")
@Validated
@Data
public class QuizAttemptProperties {

    /**
     * Longest wait for an asynchronously graded score before the attempt is abandoned.
     */
    @NotNull
    private Duration gradingTimeout = Duration.ofSeconds(10);
}
