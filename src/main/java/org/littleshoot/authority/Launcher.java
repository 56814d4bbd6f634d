package org.littleshoot.authority;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.Properties;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.cli.UnrecognizedOptionException;
import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.xml.DOMConfigurator;
import org.littleshoot.authority.impl.AuthorityConfig;
import org.littleshoot.authority.impl.DefaultCertificateAuthority;
import org.littleshoot.authority.impl.IssuedCertificate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs root certificate authority commands from the command line.
 */
public class Launcher {

    private static final Logger LOG = LoggerFactory.getLogger(Launcher.class);

    private static final String OPTION_CONFIG = "config";

    private static final String OPTION_DATA_DIR = "data-dir";

    private static final String OPTION_SHOW = "show";

    private static final String OPTION_REGENERATE = "regenerate";

    private static final String OPTION_RESET = "reset";

    private static final String OPTION_EXPORT = "export";

    private static final String OPTION_PASSWORD = "password";

    private static final String OPTION_ISSUE = "issue";

    private static final String OPTION_HELP = "help";

    private static final String DEFAULT_CONFIG_FILE = "./authority.properties";

    private final PrintStream out;

    public Launcher(PrintStream out) {
        this.out = out;
    }

    /**
     * Runs the commands from the command line.
     *
     * @param args
     *            Any command line arguments.
     */
    public static void main(final String... args) {
        pollLog4JConfigurationFileIfAvailable();
        int status = new Launcher(System.out).run(args);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * @return the process exit status
     */
    public int run(final String... args) {
        LOG.info("Running with args: {}", Arrays.asList(args));
        final Options options = options();

        final CommandLineParser parser = new DefaultParser();
        final CommandLine cmd;
        try {
            cmd = parser.parse(options, args);
            if (cmd.getArgs().length > 0) {
                throw new UnrecognizedOptionException(
                        "Extra arguments were provided in "
                                + Arrays.asList(args));
            }
        } catch (final ParseException e) {
            printHelp(options,
                    "Could not parse command line: " + Arrays.asList(args));
            return 2;
        }
        if (cmd.hasOption(OPTION_HELP)) {
            printHelp(options, null);
            return 0;
        }
        if (cmd.hasOption(OPTION_EXPORT) && !cmd.hasOption(OPTION_PASSWORD)) {
            printHelp(options, "--" + OPTION_EXPORT + " needs --"
                    + OPTION_PASSWORD);
            return 2;
        }

        DefaultCertificateAuthority ca = new DefaultCertificateAuthority(
                config(cmd));
        try {
            if (cmd.hasOption(OPTION_RESET)) {
                ca.resetToDefault();
                out.println("Restored the default root certificate");
            }
            if (cmd.hasOption(OPTION_REGENERATE)) {
                ca.regenerate(cmd.getOptionValue(OPTION_REGENERATE));
                out.println("Generated a new root certificate");
            }
            if (cmd.hasOption(OPTION_EXPORT)) {
                byte[] bundle = ca.exportTrustBundle(cmd.getOptionValue(
                        OPTION_PASSWORD).toCharArray());
                File target = new File(cmd.getOptionValue(OPTION_EXPORT));
                Files.write(target.toPath(), bundle);
                out.println("Wrote trust bundle to " + target);
            }
            if (cmd.hasOption(OPTION_ISSUE)) {
                IssuedCertificate issued = ca.certificateFor(cmd
                        .getOptionValue(OPTION_ISSUE));
                out.print(issued.toPem());
            }
            if (cmd.hasOption(OPTION_SHOW)) {
                out.println(ca.rootCertificate().getSubjectX500Principal());
                out.print(ca.rootCertificatePem());
            }
        } catch (RootCertificateException | IOException e) {
            LOG.error("Command failed", e);
            System.err.println(e.getMessage());
            return 1;
        }
        return 0;
    }

    private static Options options() {
        final Options options = new Options();
        options.addOption(null, OPTION_CONFIG, true,
                "Read settings from the given properties file.");
        options.addOption(null, OPTION_DATA_DIR, true,
                "Directory holding ca.crt and ca_key.pem.");
        options.addOption(null, OPTION_SHOW, false,
                "Print the current root certificate.");
        options.addOption(null, OPTION_REGENERATE, true,
                "Generate a new root certificate, named after the given host.");
        options.addOption(null, OPTION_RESET, false,
                "Go back to the bundled default root certificate.");
        options.addOption(null, OPTION_EXPORT, true,
                "Write a PKCS#12 trust bundle to the given file.");
        options.addOption(null, OPTION_PASSWORD, true,
                "Password of the exported trust bundle.");
        options.addOption(null, OPTION_ISSUE, true,
                "Print the certificate issued for the given host.");
        options.addOption(null, OPTION_HELP, false,
                "Display command line help.");
        return options;
    }

    private static AuthorityConfig config(CommandLine cmd) {
        Properties props = AuthorityConfig.loadProperties(cmd.getOptionValue(
                OPTION_CONFIG, DEFAULT_CONFIG_FILE));
        if (cmd.hasOption(OPTION_DATA_DIR)) {
            props.setProperty(AuthorityConfig.DATA_DIR,
                    cmd.getOptionValue(OPTION_DATA_DIR));
        }
        return AuthorityConfig.fromProperties(props);
    }

    private void printHelp(final Options options, final String errorMessage) {
        if (!StringUtils.isBlank(errorMessage)) {
            LOG.error(errorMessage);
            System.err.println(errorMessage);
        }

        final HelpFormatter formatter = new HelpFormatter();
        formatter.printHelp("littleproxy-authority", options);
    }

    private static void pollLog4JConfigurationFileIfAvailable() {
        File log4jConfigurationFile = new File("src/test/resources/log4j.xml");
        if (log4jConfigurationFile.exists()) {
            DOMConfigurator.configureAndWatch(
                    log4jConfigurationFile.getAbsolutePath(), 15);
        }
    }
}
