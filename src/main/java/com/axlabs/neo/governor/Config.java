package com.axlabs.neo.governor;

import io.neow3j.types.Hash160;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigInteger;
import java.util.Properties;

import static com.axlabs.neo.governor.ErrorKind.INVALID_CONFIGURATION;

/**
 * Reads the governor configuration from a properties file on the classpath.
 */
public class Config {

    // Property keys
    static final String NAME_KEY = "name";
    static final String QUORUM_VOTES_KEY = "quorum_votes";
    static final String PROPOSAL_THRESHOLD_KEY = "proposal_threshold";
    static final String PROPOSAL_MAX_OPERATIONS_KEY = "proposal_max_operations";
    static final String VOTING_PERIOD_KEY = "voting_period"; // checkpoints
    static final String PROPOSAL_LIFETIME_KEY = "proposal_lifetime"; // checkpoints
    static final String TOKEN_KEY = "token";
    static final String GOVERNOR_KEY = "governor";
    static final String NETWORK_MAGIC_KEY = "network_magic";

    static final String DEFAULT_PROPS_FILE = "governor.properties";

    private static String propsFile = DEFAULT_PROPS_FILE;
    private static Properties props;

    /**
     * Switches to another properties file. The file is read on the next property access.
     *
     * @param fileName The name of the properties file on the classpath.
     */
    public static synchronized void setPropertiesFile(String fileName) {
        propsFile = fileName;
        props = null;
    }

    public static synchronized String getProperty(String name) {
        if (props == null) {
            props = load(propsFile);
        }
        return props.getProperty(name);
    }

    public static String getRequiredProperty(String name) {
        String value = getProperty(name);
        if (value == null || value.trim().isEmpty()) {
            throw new GovernorException(INVALID_CONFIGURATION,
                    "[Config.getRequiredProperty] Missing property '" + name + "' in " + propsFile);
        }
        return value.trim();
    }

    public static int getIntProperty(String name) {
        try {
            return Integer.parseInt(getRequiredProperty(name));
        } catch (NumberFormatException e) {
            throw new GovernorException(INVALID_CONFIGURATION,
                    "[Config.getIntProperty] Property '" + name + "' is not an integer", e);
        }
    }

    public static long getLongProperty(String name) {
        try {
            return Long.parseLong(getRequiredProperty(name));
        } catch (NumberFormatException e) {
            throw new GovernorException(INVALID_CONFIGURATION,
                    "[Config.getLongProperty] Property '" + name + "' is not an integer", e);
        }
    }

    public static BigInteger getBigIntegerProperty(String name) {
        try {
            return new BigInteger(getRequiredProperty(name));
        } catch (NumberFormatException e) {
            throw new GovernorException(INVALID_CONFIGURATION,
                    "[Config.getBigIntegerProperty] Property '" + name + "' is not an integer", e);
        }
    }

    /**
     * Reads a script hash property. Accepts both hex strings and Neo addresses.
     */
    public static Hash160 getHash160Property(String name) {
        String value = getRequiredProperty(name);
        try {
            if (value.startsWith("N")) {
                return Hash160.fromAddress(value);
            }
            return new Hash160(value);
        } catch (IllegalArgumentException e) {
            throw new GovernorException(INVALID_CONFIGURATION,
                    "[Config.getHash160Property] Property '" + name + "' is not a script hash or address", e);
        }
    }

    public static GovernorParameters getGovernorParameters() {
        return new GovernorParameters(
                getRequiredProperty(NAME_KEY),
                getBigIntegerProperty(QUORUM_VOTES_KEY),
                getBigIntegerProperty(PROPOSAL_THRESHOLD_KEY),
                getIntProperty(PROPOSAL_MAX_OPERATIONS_KEY),
                getIntProperty(VOTING_PERIOD_KEY),
                getIntProperty(PROPOSAL_LIFETIME_KEY),
                getHash160Property(TOKEN_KEY),
                getHash160Property(GOVERNOR_KEY),
                getLongProperty(NETWORK_MAGIC_KEY));
    }

    private static Properties load(String fileName) {
        Properties properties = new Properties();
        try (InputStream in = Config.class.getClassLoader().getResourceAsStream(fileName)) {
            if (in == null) {
                throw new GovernorException(INVALID_CONFIGURATION,
                        "[Config.load] Properties file '" + fileName + "' not found on the classpath");
            }
            properties.load(in);
        } catch (IOException e) {
            throw new GovernorException(INVALID_CONFIGURATION,
                    "[Config.load] Failed to read properties file '" + fileName + "'", e);
        }
        return properties;
    }
}
