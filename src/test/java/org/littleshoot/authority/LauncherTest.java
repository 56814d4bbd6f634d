package org.littleshoot.authority;

import static org.hamcrest.Matchers.*;
import static org.junit.Assert.*;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.security.KeyStore;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class LauncherTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private ByteArrayOutputStream output;

    private Launcher launcher;

    private String dataDir;

    private String configFile;

    @Before
    public void setUp() throws Exception {
        output = new ByteArrayOutputStream();
        launcher = new Launcher(new PrintStream(output, true, "UTF-8"));
        dataDir = new File(tmp.getRoot(), "data").getPath();
        File config = tmp.newFile("authority.properties");
        Files.write(config.toPath(), ("key_size=1024\n"
                + "allow_legacy_renegotiation=false\n")
                .getBytes(StandardCharsets.ISO_8859_1));
        configFile = config.getPath();
    }

    private int run(String... args) {
        String[] all = new String[args.length + 4];
        all[0] = "--config";
        all[1] = configFile;
        all[2] = "--data-dir";
        all[3] = dataDir;
        System.arraycopy(args, 0, all, 4, args.length);
        return launcher.run(all);
    }

    private String output() {
        return new String(output.toByteArray(), StandardCharsets.UTF_8);
    }

    @Test
    public void testShowPrintsDefaultRoot() {
        assertEquals(0, run("--show"));

        assertThat(output(), containsString("CN=LittleProxy Default CA"));
        assertThat(output(), containsString("-----BEGIN CERTIFICATE-----"));
        assertTrue(new File(dataDir, "ca.crt").isFile());
    }

    @Test
    public void testRegenerateThenShow() {
        assertEquals(0, run("--regenerate", "build-box", "--show"));

        assertThat(output(), containsString("Generated a new root certificate"));
        assertThat(output(), containsString("LittleProxy CA (build-box)"));
    }

    @Test
    public void testResetOnFreshInstallFails() {
        assertEquals(1, run("--reset"));
    }

    @Test
    public void testResetAfterRegenerate() {
        assertEquals(0, run("--regenerate", "build-box"));
        assertEquals(0, run("--reset", "--show"));

        assertThat(output(), containsString("CN=LittleProxy Default CA"));
    }

    @Test
    public void testExportNeedsPassword() throws Exception {
        File target = new File(tmp.getRoot(), "bundle.p12");

        assertEquals(2, run("--export", target.getPath()));
        assertFalse(target.exists());
    }

    @Test
    public void testExportWritesBundle() throws Exception {
        File target = new File(tmp.getRoot(), "bundle.p12");

        assertEquals(0, run("--export", target.getPath(), "--password",
                "secret"));

        KeyStore ks = KeyStore.getInstance("PKCS12");
        ks.load(new ByteArrayInputStream(Files.readAllBytes(target.toPath())),
                "secret".toCharArray());
        assertTrue(ks.isKeyEntry("littleproxy"));
    }

    @Test
    public void testIssuePrintsLeaf() {
        assertEquals(0, run("--issue", "example.com"));

        assertThat(output(), startsWith("-----BEGIN CERTIFICATE-----"));
    }

    @Test
    public void testUnknownOptionFails() {
        assertEquals(2, run("--bogus"));
    }

    @Test
    public void testHelp() {
        assertEquals(0, launcher.run("--help"));
    }
}
