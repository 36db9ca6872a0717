package com.lintmux.child;

import com.lintmux.core.model.VersionRange;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "lintmux")
public class ChildProperties {

    private Child child = new Child();

    // -- Child accessors (delegate to nested) --
    public String getManifestName() { return child.manifestName; }
    public int getRequestTimeoutSeconds() { return child.requestTimeoutSeconds; }
    public int getShutdownTimeoutSeconds() { return child.shutdownTimeoutSeconds; }

    /**
     * Protocol versions a child may report during its handshake, bounds included.
     */
    public VersionRange getAcceptedProtocolVersions() {
        return VersionRange.of(child.minProtocolVersion, child.maxProtocolVersion);
    }

    public Child getChild() { return child; }
    public void setChild(Child child) { this.child = child; }

    public static class Child {
        private String manifestName = ".lintmux.json";
        private String minProtocolVersion = "1.0.0";
        private String maxProtocolVersion = "1.999.0";
        private int requestTimeoutSeconds = 60;
        private int shutdownTimeoutSeconds = 5;

        public String getManifestName() { return manifestName; }
        public void setManifestName(String manifestName) { this.manifestName = manifestName; }
        public String getMinProtocolVersion() { return minProtocolVersion; }
        public void setMinProtocolVersion(String minProtocolVersion) { this.minProtocolVersion = minProtocolVersion; }
        public String getMaxProtocolVersion() { return maxProtocolVersion; }
        public void setMaxProtocolVersion(String maxProtocolVersion) { this.maxProtocolVersion = maxProtocolVersion; }
        public int getRequestTimeoutSeconds() { return requestTimeoutSeconds; }
        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) { this.requestTimeoutSeconds = requestTimeoutSeconds; }
        public int getShutdownTimeoutSeconds() { return shutdownTimeoutSeconds; }
        public void setShutdownTimeoutSeconds(int shutdownTimeoutSeconds) { this.shutdownTimeoutSeconds = shutdownTimeoutSeconds; }
    }
}
