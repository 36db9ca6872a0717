package com.lintmux.core.engine;

import com.lintmux.core.model.VersionCheckParams;
import com.lintmux.core.model.VersionRange;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "lintmux")
public class PluginProperties {

    private Plugin plugin = new Plugin();
    private Host host = new Host();

    // -- Plugin accessors (delegate to nested) --
    public String getName() { return plugin.name; }
    public String getVersion() { return plugin.version; }
    public String getContactInfo() { return plugin.contactInfo; }
    public List<String> getFileGlobs() { return plugin.fileGlobs; }

    // -- Host accessors (delegate to nested) --

    /**
     * Host versions accepted by {@code plugin.versionCheck}, bounds included.
     */
    public VersionRange getAcceptedHostVersions() {
        return VersionRange.of(host.minVersion, host.maxVersion);
    }

    /**
     * Version-check payload replayed to children that start before the host
     * sent its own.
     */
    public VersionCheckParams getDefaultVersionCheck() {
        return new VersionCheckParams(host.byteStorePath, host.sdkPath, host.minVersion);
    }

    public Plugin getPlugin() { return plugin; }
    public void setPlugin(Plugin plugin) { this.plugin = plugin; }
    public Host getHost() { return host; }
    public void setHost(Host host) { this.host = host; }

    public static class Plugin {
        private String name = "lintmux";
        private String version = "1.0.0";
        private String contactInfo = "";
        private List<String> fileGlobs = new ArrayList<>(List.of("*"));

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public String getVersion() { return version; }
        public void setVersion(String version) { this.version = version; }
        public String getContactInfo() { return contactInfo; }
        public void setContactInfo(String contactInfo) { this.contactInfo = contactInfo; }
        public List<String> getFileGlobs() { return fileGlobs; }
        public void setFileGlobs(List<String> fileGlobs) { this.fileGlobs = fileGlobs; }
    }

    public static class Host {
        private String minVersion = "1.0.0";
        private String maxVersion = "1.999.0";
        private String byteStorePath = System.getProperty("java.io.tmpdir");
        private String sdkPath = "";

        public String getMinVersion() { return minVersion; }
        public void setMinVersion(String minVersion) { this.minVersion = minVersion; }
        public String getMaxVersion() { return maxVersion; }
        public void setMaxVersion(String maxVersion) { this.maxVersion = maxVersion; }
        public String getByteStorePath() { return byteStorePath; }
        public void setByteStorePath(String byteStorePath) { this.byteStorePath = byteStorePath; }
        public String getSdkPath() { return sdkPath; }
        public void setSdkPath(String sdkPath) { this.sdkPath = sdkPath; }
    }
}
