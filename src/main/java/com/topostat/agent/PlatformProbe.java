package com.topostat.agent;

import com.topostat.core.model.PlatformInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Describes the host an agent runs on: distribution, generalized architecture and
 * kernel version. Only Linux hosts produce a {@link PlatformInfo}.
 */
@Component
public class PlatformProbe {

    private static final Logger log = LoggerFactory.getLogger(PlatformProbe.class);

    static final Path RELEASE_FILE = Path.of("/etc/os-release");

    private final Path releaseFile;
    private final String osName;
    private final String osArch;
    private final String osVersion;

    @Autowired
    public PlatformProbe() {
        this(RELEASE_FILE, System.getProperty("os.name"), System.getProperty("os.arch"),
                System.getProperty("os.version"));
    }

    PlatformProbe(Path releaseFile, String osName, String osArch, String osVersion) {
        this.releaseFile = releaseFile;
        this.osName = osName;
        this.osArch = osArch;
        this.osVersion = osVersion;
    }

    public Optional<PlatformInfo> probe() {
        if (!"Linux".equals(osName)) {
            log.debug("Not a Linux host ({}); no platform information", osName);
            return Optional.empty();
        }
        PlatformInfo info = new PlatformInfo(distribution(), architecture(), kernelVersion());
        if (!info.isValid()) {
            log.warn("Incomplete platform information: {}", info);
            return Optional.empty();
        }
        return Optional.of(info);
    }

    /** Distribution name and version from the release file, e.g. {@code Debian 12}. */
    String distribution() {
        List<String> lines;
        try {
            if (!Files.isRegularFile(releaseFile)) {
                return null;
            }
            lines = Files.readAllLines(releaseFile);
        } catch (IOException e) {
            log.warn("Unable to read {}", releaseFile, e);
            return null;
        }
        String id = value(lines, "ID");
        String version = value(lines, "VERSION_ID");
        if (id == null || id.isEmpty() || version == null || version.isEmpty()) {
            return null;
        }
        String name = switch (id) {
            case "debian" -> "Debian";
            case "ubuntu" -> "Ubuntu";
            default -> Character.toUpperCase(id.charAt(0)) + id.substring(1);
        };
        return name + " " + version;
    }

    private static String value(List<String> lines, String key) {
        for (String line : lines) {
            if (line.startsWith(key + "=")) {
                String value = line.substring(key.length() + 1).strip();
                if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
                    value = value.substring(1, value.length() - 1);
                }
                return value;
            }
        }
        return null;
    }

    /** Machine name generalized to {@code amd64}, {@code i386}, {@code arm8} or {@code arm7}. */
    String architecture() {
        if (osArch == null) {
            return null;
        }
        return switch (osArch.toLowerCase(Locale.ROOT)) {
            case "amd64", "x86_64", "x86-64" -> "amd64";
            case "i386", "i486", "i586", "i686", "x86" -> "i386";
            case "aarch64", "aarch64_be", "armv8b", "armv8l", "arm64" -> "arm8";
            case "arm", "armhf", "armv7l" -> "arm7";
            default -> null;
        };
    }

    /** Kernel release without the distribution suffix, e.g. {@code 6.1.0} for {@code 6.1.0-18-amd64}. */
    String kernelVersion() {
        if (osVersion == null || osVersion.isEmpty()) {
            return null;
        }
        return osVersion.split("-", 2)[0];
    }

    /** Host name used as agent name when none is configured. */
    public String hostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            String fromEnv = System.getenv("HOSTNAME");
            log.warn("Unable to resolve local host name, falling back to '{}'", fromEnv);
            return fromEnv;
        }
    }
}
