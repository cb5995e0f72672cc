package com.sekisho.gateway.config;

import com.sekisho.gateway.core.exceptions.ConfigException;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads {@link GatewayProperties} from YAML and applies environment overrides.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    /** Environment variable that forces single-target mode with the given URL. */
    public static final String PROXY_TARGET_URL_ENV = "PROXY_TARGET_URL";

    private final UnaryOperator<String> env;

    public ConfigLoader() {
        this(System::getenv);
    }

    /**
     * @param env environment lookup, returning null for unset variables.
     */
    public ConfigLoader(UnaryOperator<String> env) {
        this.env = env;
    }

    /**
     * Loads the configuration from the specified path or classpath, applies
     * environment overrides and validates the result.
     *
     * @param path Path to the configuration file.
     * @return validated properties.
     * @throws ConfigException if configuration cannot be loaded or is invalid.
     */
    public GatewayProperties load(String path) {
        Yaml yaml = new Yaml(new Constructor(GatewayProperties.class, new LoaderOptions()));

        GatewayProperties props = tryLoadFromFile(yaml, path);
        if (props == null) {
            props = tryLoadFromClasspath(yaml, path);
        }
        if (props == null) {
            throw new ConfigException("Configuration file not found: " + path);
        }

        applyEnvironment(props);
        props.validate();
        return props;
    }

    /**
     * Fills values the YAML file leaves to the environment.
     *
     * @param props properties to update in place.
     */
    void applyEnvironment(GatewayProperties props) {
        JwtConfig jwt = props.getJwt();
        if (jwt != null && (jwt.getSecret() == null || jwt.getSecret().isBlank())
                && jwt.getSecretEnv() != null && !jwt.getSecretEnv().isBlank()) {
            String secret = env.apply(jwt.getSecretEnv());
            if (secret != null && !secret.isBlank()) {
                jwt.setSecret(secret);
            }
        }

        String legacyUrl = env.apply(PROXY_TARGET_URL_ENV);
        if (legacyUrl != null && !legacyUrl.isBlank() && props.getProxy() != null) {
            log.info("{} is set, using single-target mode", PROXY_TARGET_URL_ENV);
            Map<String, String> targets = new LinkedHashMap<>();
            targets.put(ProxyConfig.DEFAULT_TARGET, legacyUrl.trim());
            props.getProxy().setTargets(targets);
        }
    }

    private GatewayProperties tryLoadFromFile(Yaml yaml, String path) {
        File file = new File(path);
        if (file.exists()) {
            try (InputStream is = new FileInputStream(file)) {
                return yaml.load(is);
            } catch (YAMLException e) {
                throw new ConfigException("Invalid YAML in " + path + ": " + e.getMessage());
            } catch (IOException e) {
                throw new ConfigException("Error reading config file: " + path, e);
            }
        }
        return null;
    }

    private GatewayProperties tryLoadFromClasspath(Yaml yaml, String path) {
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(path)) {
            if (is != null) {
                return yaml.load(is);
            }
        } catch (YAMLException e) {
            throw new ConfigException("Invalid YAML in classpath resource " + path + ": " + e.getMessage());
        } catch (IOException e) {
            log.debug("Classpath resource lookup failed for {}", path);
        }
        return null;
    }
}
