package org.littleshoot.authority.impl;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

import org.apache.commons.io.IOUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable settings of the certificate authority: where the key material
 * lives and how generated certificates are named and sized.
 *
 * <pre>
 * AuthorityConfig config = AuthorityConfig.fromFile("./authority.properties");
 * DefaultCertificateAuthority ca = new DefaultCertificateAuthority(config);
 * </pre>
 */
public class AuthorityConfig {

    private static final Logger LOG = LoggerFactory
            .getLogger(AuthorityConfig.class);

    public static final String DATA_DIR = "data_dir";
    public static final String ROOT_CN_PREFIX = "root_cn_prefix";
    public static final String ORGANIZATION = "organization";
    public static final String ORGANIZATIONAL_UNIT = "organizational_unit";
    public static final String COUNTRY = "country";
    public static final String STATE = "state";
    public static final String LOCALITY = "locality";
    public static final String KEY_SIZE = "key_size";
    public static final String LEAF_VALIDITY_DAYS = "leaf_validity_days";
    public static final String ROOT_VALIDITY_DAYS = "root_validity_days";
    public static final String TRUST_BUNDLE_ALIAS = "trust_bundle_alias";
    public static final String ALLOW_LEGACY_RENEGOTIATION = "allow_legacy_renegotiation";
    public static final String DEFAULT_HOST = "default_host";

    private final Path dataDir;
    private final String rootCommonNamePrefix;
    private final String organization;
    private final String organizationalUnit;
    private final String country;
    private final String state;
    private final String locality;
    private final int keySize;
    private final int leafValidityDays;
    private final int rootValidityDays;
    private final String trustBundleAlias;
    private final boolean allowLegacyRenegotiation;
    private final String defaultHost;

    private AuthorityConfig(Builder builder) {
        this.dataDir = builder.dataDir;
        this.rootCommonNamePrefix = builder.rootCommonNamePrefix;
        this.organization = builder.organization;
        this.organizationalUnit = builder.organizationalUnit;
        this.country = builder.country;
        this.state = builder.state;
        this.locality = builder.locality;
        this.keySize = builder.keySize;
        this.leafValidityDays = builder.leafValidityDays;
        this.rootValidityDays = builder.rootValidityDays;
        this.trustBundleAlias = builder.trustBundleAlias;
        this.allowLegacyRenegotiation = builder.allowLegacyRenegotiation;
        this.defaultHost = builder.defaultHost;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static AuthorityConfig defaults() {
        return builder().build();
    }

    /**
     * Reads the configuration from a properties file. A missing or unreadable
     * file yields the defaults.
     */
    public static AuthorityConfig fromFile(String path) {
        return fromProperties(loadProperties(path));
    }

    /**
     * Loads a properties file, returning empty properties if there is none.
     */
    public static Properties loadProperties(String path) {
        final File propsFile = new File(path);
        final Properties props = new Properties();

        if (propsFile.isFile()) {
            InputStream is = null;
            try {
                is = new FileInputStream(propsFile);
                props.load(is);
            } catch (final IOException e) {
                LOG.warn("Could not load props file?", e);
            } finally {
                IOUtils.closeQuietly(is);
            }
        }
        return props;
    }

    public static AuthorityConfig fromProperties(Properties props) {
        Builder builder = builder();
        String dir = props.getProperty(DATA_DIR);
        if (StringUtils.isNotBlank(dir)) {
            builder.withDataDir(Paths.get(dir.trim()));
        }
        builder.withRootCommonNamePrefix(extractString(props, ROOT_CN_PREFIX,
                builder.rootCommonNamePrefix));
        builder.withOrganization(extractString(props, ORGANIZATION,
                builder.organization));
        builder.withOrganizationalUnit(extractString(props,
                ORGANIZATIONAL_UNIT, builder.organizationalUnit));
        builder.withCountry(extractString(props, COUNTRY, builder.country));
        builder.withState(extractString(props, STATE, builder.state));
        builder.withLocality(extractString(props, LOCALITY, builder.locality));
        builder.withKeySize(extractInt(props, KEY_SIZE, builder.keySize));
        builder.withLeafValidityDays(extractInt(props, LEAF_VALIDITY_DAYS,
                builder.leafValidityDays));
        builder.withRootValidityDays(extractInt(props, ROOT_VALIDITY_DAYS,
                builder.rootValidityDays));
        builder.withTrustBundleAlias(extractString(props, TRUST_BUNDLE_ALIAS,
                builder.trustBundleAlias));
        builder.withAllowLegacyRenegotiation(extractBoolean(props,
                ALLOW_LEGACY_RENEGOTIATION, builder.allowLegacyRenegotiation));
        builder.withDefaultHost(extractString(props, DEFAULT_HOST,
                builder.defaultHost));
        return builder.build();
    }

    private static String extractString(Properties props, String key,
            String defaultValue) {
        final String value = props.getProperty(key);
        if (StringUtils.isNotBlank(value)) {
            return value.trim();
        }
        return defaultValue;
    }

    private static int extractInt(Properties props, String key,
            int defaultValue) {
        final String value = props.getProperty(key);
        if (StringUtils.isNotBlank(value)
                && NumberUtils.isDigits(value.trim())) {
            // out of int range falls back to the default too
            return NumberUtils.toInt(value.trim(), defaultValue);
        }
        return defaultValue;
    }

    private static boolean extractBoolean(Properties props, String key,
            boolean defaultValue) {
        final String value = props.getProperty(key);
        if (StringUtils.isNotBlank(value)) {
            return value.trim().equalsIgnoreCase("true");
        }
        return defaultValue;
    }

    public Path dataDir() {
        return dataDir;
    }

    public Path certificateFile() {
        return dataDir.resolve(FileKeyMaterialStore.CERTIFICATE_FILE);
    }

    public Path privateKeyFile() {
        return dataDir.resolve(FileKeyMaterialStore.PRIVATE_KEY_FILE);
    }

    public String rootCommonNamePrefix() {
        return rootCommonNamePrefix;
    }

    public String organization() {
        return organization;
    }

    public String organizationalUnit() {
        return organizationalUnit;
    }

    public String country() {
        return country;
    }

    public String state() {
        return state;
    }

    public String locality() {
        return locality;
    }

    public int keySize() {
        return keySize;
    }

    public int leafValidityDays() {
        return leafValidityDays;
    }

    public int rootValidityDays() {
        return rootValidityDays;
    }

    public String trustBundleAlias() {
        return trustBundleAlias;
    }

    public boolean isAllowLegacyRenegotiation() {
        return allowLegacyRenegotiation;
    }

    public String defaultHost() {
        return defaultHost;
    }

    @Override
    public String toString() {
        return "AuthorityConfig [dataDir=" + dataDir + ", organization="
                + organization + ", organizationalUnit=" + organizationalUnit
                + ", keySize=" + keySize + ", leafValidityDays="
                + leafValidityDays + ", rootValidityDays=" + rootValidityDays
                + "]";
    }

    public static class Builder {

        private Path dataDir = Paths.get(System.getProperty("user.home"),
                ".littleproxy");
        private String rootCommonNamePrefix = "LittleProxy CA";
        private String organization = "LittleProxy";
        private String organizationalUnit = "LittleProxy MITM";
        private String country = "US";
        private String state = "CA";
        private String locality = "Los Angeles";
        private int keySize = 2048;
        private int leafValidityDays = 365;
        private int rootValidityDays = 825;
        private String trustBundleAlias = "littleproxy";
        private boolean allowLegacyRenegotiation = true;
        private String defaultHost = "localhost";

        private Builder() {
        }

        public Builder withDataDir(Path dataDir) {
            this.dataDir = dataDir;
            return this;
        }

        public Builder withRootCommonNamePrefix(String rootCommonNamePrefix) {
            this.rootCommonNamePrefix = rootCommonNamePrefix;
            return this;
        }

        public Builder withOrganization(String organization) {
            this.organization = organization;
            return this;
        }

        public Builder withOrganizationalUnit(String organizationalUnit) {
            this.organizationalUnit = organizationalUnit;
            return this;
        }

        public Builder withCountry(String country) {
            this.country = country;
            return this;
        }

        public Builder withState(String state) {
            this.state = state;
            return this;
        }

        public Builder withLocality(String locality) {
            this.locality = locality;
            return this;
        }

        public Builder withKeySize(int keySize) {
            this.keySize = keySize;
            return this;
        }

        public Builder withLeafValidityDays(int leafValidityDays) {
            this.leafValidityDays = leafValidityDays;
            return this;
        }

        public Builder withRootValidityDays(int rootValidityDays) {
            this.rootValidityDays = rootValidityDays;
            return this;
        }

        public Builder withTrustBundleAlias(String trustBundleAlias) {
            this.trustBundleAlias = trustBundleAlias;
            return this;
        }

        public Builder withAllowLegacyRenegotiation(
                boolean allowLegacyRenegotiation) {
            this.allowLegacyRenegotiation = allowLegacyRenegotiation;
            return this;
        }

        public Builder withDefaultHost(String defaultHost) {
            this.defaultHost = defaultHost;
            return this;
        }

        public AuthorityConfig build() {
            if (dataDir == null) {
                throw new IllegalArgumentException(
                        "Error, 'dataDir' is not allowed to be null!");
            }
            if (keySize < 1024) {
                throw new IllegalArgumentException("Key size too small: "
                        + keySize);
            }
            if (leafValidityDays <= 0 || rootValidityDays <= 0) {
                throw new IllegalArgumentException(
                        "Validity has to be at least one day");
            }
            return new AuthorityConfig(this);
        }
    }
}
