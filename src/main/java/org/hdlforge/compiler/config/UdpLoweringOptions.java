package org.hdlforge.compiler.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.hdlforge.compiler.frontend.ast.AlwaysKeyword;

/**
 * Settings of the UDP table lowering pass, read from the {@code hdlforge.compiler.udp}
 * block of the HOCON configuration.
 *
 * @param fieldVariableName Name of the synthesized input field temporary.
 * @param processKeyword Flavor of the process hosting the table logic.
 * @param dumpTree Whether the lowered tree is logged at DEBUG level.
 * @param checkTree Whether the tree consistency check runs after lowering.
 */
public record UdpLoweringOptions(
        String fieldVariableName,
        AlwaysKeyword processKeyword,
        boolean dumpTree,
        boolean checkTree
) {

    /** Path of the settings block in the configuration. */
    public static final String CONFIG_PATH = "hdlforge.compiler.udp";

    public UdpLoweringOptions {
        if (fieldVariableName == null || fieldVariableName.isBlank()) {
            throw new IllegalArgumentException("fieldVariableName must not be blank");
        }
        if (!processKeyword.holdsOutputs()) {
            throw new IllegalArgumentException("processKeyword must hold outputs between evaluations, got: " + processKeyword);
        }
    }

    /**
     * Reads the options from a {@code udp} settings block.
     *
     * @param config The block at {@link #CONFIG_PATH}.
     * @return The options.
     * @throws ConfigException.BadValue if the process keyword is unknown.
     */
    public static UdpLoweringOptions fromConfig(Config config) {
        String keyword = config.getString("process-keyword");
        AlwaysKeyword processKeyword;
        try {
            processKeyword = AlwaysKeyword.valueOf(keyword);
        } catch (IllegalArgumentException e) {
            throw new ConfigException.BadValue(config.origin(), "process-keyword", "Unknown process keyword: " + keyword, e);
        }
        return new UdpLoweringOptions(
                config.getString("field-variable-name"),
                processKeyword,
                config.getBoolean("dump-tree"),
                config.getBoolean("check-tree"));
    }

    /**
     * Loads the options from the application configuration, falling back to {@code reference.conf}.
     * @return The options.
     */
    public static UdpLoweringOptions defaults() {
        return fromConfig(ConfigFactory.load().getConfig(CONFIG_PATH));
    }
}
