package com.raditha.sentinel.cli;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class SentinelCLITest {

    private static final String EXPECTED_CALLS = "\"calls\": [\"AddressAliasHelper.applyL1ToL2Alias\"]";

    private ByteArrayOutputStream outContent;
    private ByteArrayOutputStream errContent;
    private PrintStream originalOut;
    private PrintStream originalErr;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        outContent = new ByteArrayOutputStream();
        errContent = new ByteArrayOutputStream();
        originalOut = System.out;
        originalErr = System.err;
        System.setOut(new PrintStream(outContent));
        System.setErr(new PrintStream(errContent));
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    private String portalJson() throws IOException {
        try (InputStream in = getClass().getResourceAsStream("/models/optimism-portal.json")) {
            assertNotNull(in, "fixture missing");
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private Path writeModel(String json) throws IOException {
        return Files.writeString(tempDir.resolve("model.json"), json);
    }

    @Test
    void testPassingModelExitsZero() throws IOException {
        Path model = writeModel(portalJson());

        int exitCode = SentinelCLI.execute("--model", model.toString());

        assertEquals(0, exitCode);
        String output = outContent.toString();
        assertTrue(output.contains("Echidna property tests:"));
        assertTrue(output.contains("Contract: EchidnaFuzzOptimismPortal (inherits from: OptimismPortal)"));
        assertTrue(output.contains("\t-EchidnaFuzzOptimismPortal.echidna_deposit_completes()"));
        assertTrue(output.contains("\t-EchidnaFuzzOptimismPortal.echidna_mint_not_inflated(uint256)"));
        assertFalse(output.contains("testDeposit"));
        assertTrue(output.contains("Running OptimismPortal.depositTransaction test (deposit-transaction-integrity)..."));
        assertTrue(output.contains("Test passed"));
        assertTrue(output.contains("1 rule(s) run, 1 passed, 0 failed"));
    }

    @Test
    void testScanModeSkipsVerification() throws IOException {
        Path model = writeModel(portalJson());

        int exitCode = SentinelCLI.execute("--model", model.toString(), "--mode", "scan");

        assertEquals(0, exitCode);
        String output = outContent.toString();
        assertTrue(output.contains("Echidna property tests:"));
        assertFalse(output.contains("Running "));
    }

    @Test
    void testVerifyModeSkipsScan() throws IOException {
        Path model = writeModel(portalJson());

        int exitCode = SentinelCLI.execute("--model", model.toString(), "--mode", "verify");

        assertEquals(0, exitCode);
        String output = outContent.toString();
        assertFalse(output.contains("Echidna property tests:"));
        assertTrue(output.contains("Test passed"));
    }

    @Test
    void testPrefixOverride() throws IOException {
        Path model = writeModel(portalJson());

        int exitCode = SentinelCLI.execute("--model", model.toString(), "--mode", "scan", "--prefix", "test");

        assertEquals(0, exitCode);
        String output = outContent.toString();
        assertFalse(output.contains("EchidnaFuzzOptimismPortal"));
        assertTrue(output.contains("<none>"));
    }

    @Test
    void testChangedCallSetExitsOne() throws IOException {
        String changed = portalJson().replace(EXPECTED_CALLS,
                "\"calls\": [\"AddressAliasHelper.applyL1ToL2Alias\", \"L2OutputOracle.getL2Output\"]");
        Path model = writeModel(changed);

        int exitCode = SentinelCLI.execute("--model", model.toString(), "--mode", "verify");

        assertEquals(SentinelCLI.EXIT_INVARIANT_FAILED, exitCode);
        assertTrue(outContent.toString().contains("Test FAILED [INVARIANT_VIOLATION / call-set]"));
        assertTrue(errContent.toString().contains("Invariant check failed [call-set]"));
        assertTrue(errContent.toString().contains("L2OutputOracle.getL2Output"));
    }

    @Test
    void testChangedGuardExitsOne() throws IOException {
        String changed = portalJson().replace("\"local\": \"_isCreation\"", "\"local\": \"_isDeposit\"");
        Path model = writeModel(changed);

        int exitCode = SentinelCLI.execute("--model", model.toString(), "--mode", "verify");

        assertEquals(SentinelCLI.EXIT_INVARIANT_FAILED, exitCode);
        assertTrue(errContent.toString().contains("structural pattern not found"));
    }

    @Test
    void testMissingContractExitsOne() throws IOException {
        Path model = writeModel("{\"version\": 1, \"contracts\": []}");

        int exitCode = SentinelCLI.execute("--model", model.toString(), "--mode", "verify");

        assertEquals(SentinelCLI.EXIT_INVARIANT_FAILED, exitCode);
        assertTrue(errContent.toString().contains("Could not find OptimismPortal contract"));
    }

    @Test
    void testRuleSelectionAndUnknownRule() throws IOException {
        Path model = writeModel(portalJson());

        assertEquals(0, SentinelCLI.execute("--model", model.toString(),
                "--rule", "deposit-transaction-integrity"));

        int exitCode = SentinelCLI.execute("--model", model.toString(), "--rule", "no-such-rule");
        assertEquals(SentinelCLI.EXIT_CONFIGURATION, exitCode);
        assertTrue(errContent.toString().contains("Unknown rule: no-such-rule"));
    }

    @Test
    void testCustomConfigFile() throws IOException {
        Path model = writeModel(portalJson());
        Path config = Files.writeString(tempDir.resolve("custom.yml"), """
                entry_points:
                  enabled: false
                invariants:
                  - name: portal-calls-only
                    contract: OptimismPortal
                    function: depositTransaction
                    expected_calls: [AddressAliasHelper.applyL1ToL2Alias]
                    guard_variable: _isCreation
                    operations:
                      - type_conversion: {literal: "0", target_type: address}
                      - binary: {operator: "==", result_of: 0, named_local: _to}
                      - call: {signature: "require(bool,string)", result_of: 1}
                """);

        int exitCode = SentinelCLI.execute("--model", model.toString(), "--config-file", config.toString());

        assertEquals(0, exitCode);
        String output = outContent.toString();
        assertFalse(output.contains("Echidna property tests:"));
        assertTrue(output.contains("(portal-calls-only)"));
        assertTrue(output.contains("Test passed"));
    }
}
