package com.phillippitts.geminibridge.config.security;

import com.phillippitts.geminibridge.config.properties.SecurityProperties;
import com.phillippitts.geminibridge.util.LogSanitizer;
import jakarta.annotation.PostConstruct;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

/**
 * Warns at startup when the configured bearer token is the sample placeholder or too short.
 * A blank token already fails property validation.
 */
@Component
class TokenStrengthValidator {

    private static final Logger LOG = LogManager.getLogger(TokenStrengthValidator.class);

    private final SecurityProperties props;

    TokenStrengthValidator(SecurityProperties props) {
        this.props = props;
    }

    @PostConstruct
    void validate() {
        String token = props.getBearerToken();
        if (SecurityProperties.PLACEHOLDER_TOKEN.equals(token)) {
            LOG.warn("SECURITY: bearer token is the sample placeholder; generate a random token "
                    + "before exposing the service");
        } else if (token.length() < SecurityProperties.RECOMMENDED_TOKEN_LENGTH) {
            LOG.warn("SECURITY: bearer token is only {} characters; {} or more recommended",
                    token.length(), SecurityProperties.RECOMMENDED_TOKEN_LENGTH);
        }
        LOG.info("Bearer authentication enabled: token={}", LogSanitizer.maskToken(token, 4));
    }
}
