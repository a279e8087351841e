package com.tokenx;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tokenx.SessionSettingsStore.SessionSettings;
import com.tokenx.controllers.Controller;
import com.tokenx.controllers.CredentialController;
import com.tokenx.controllers.GeneratorController;
import com.tokenx.controllers.SessionController;
import com.tokenx.controllers.VaultController;
import com.tokenx.crypto.CryptoEnvelope;
import com.tokenx.crypto.KeyDerivation;
import com.tokenx.otp.CodeGenerator;
import com.tokenx.otp.ManualCodeService;
import com.tokenx.otp.OtpUriParser;
import com.tokenx.qr.QrCodeService;
import com.tokenx.scheduler.ClipboardImportSource;
import com.tokenx.scheduler.ImportSource;
import com.tokenx.scheduler.SessionScheduler;
import com.tokenx.security.MasterKeyManager;
import com.tokenx.security.PasswordStrength;
import com.tokenx.vault.VaultKeySource;
import com.tokenx.vault.VaultSession;
import com.tokenx.vault.VaultStore;
import io.javalin.Javalin;
import io.javalin.json.JavalinJackson;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;

public class Main {

    private static final String VERSION = "1.0.0";
    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static AppLogger logger;

    public static void main(String[] args) {
        try {
            // Parse configuration from args
            AppConfig config = new AppConfig.Builder()
                    .parseArgs(args)
                    .build();

            // Initialize logging
            AppLogger.initialize(config.getLogPath(), config.isDevMode());
            logger = AppLogger.get();

            printBanner(config);

            SessionSettings settings = new SessionSettingsStore(config.getVaultPath(), objectMapper)
                    .loadOrDefault(new SessionSettings());
            VaultKeySource keySource = settings.resolveKeySource();
            logger.info("Vault key source: " + keySource.getConfigName()
                    + ", idle timeout " + settings.getIdleTimeoutSecs() + "s");

            // Master key envelope is always password-keyed; credential envelopes follow the key source
            int iterations = settings.getKdfIterations();
            CryptoEnvelope masterEnvelope = new CryptoEnvelope(KeyDerivation.PBKDF2_SHA256, iterations);
            CryptoEnvelope vaultEnvelope = new CryptoEnvelope(keySource.getDerivation(), iterations);

            VaultStore store = VaultStore.open(config.getVaultPath(), vaultEnvelope, objectMapper);
            PasswordStrength passwordStrength = new PasswordStrength(settings.getMinPasswordLength());
            MasterKeyManager masterKeys = new MasterKeyManager(config.getVaultPath(), masterEnvelope, passwordStrength);
            CodeGenerator codeGenerator = new CodeGenerator(Clock.systemUTC());
            QrCodeService qrCodeService = new QrCodeService();

            VaultSession session = new VaultSession(store, masterKeys, passwordStrength, codeGenerator,
                    new OtpUriParser(), qrCodeService, keySource,
                    Duration.ofSeconds(settings.getIdleTimeoutSecs()), Clock.systemUTC());
            logger.info("Vault opened: " + config.getVaultPath() + " (" + session.getState() + ")");

            ImportSource importSource = null;
            if (config.isClipboardImport() && settings.isClipboardImport()) {
                importSource = ClipboardImportSource.system();
                if (importSource == null) {
                    logger.info("Clipboard not available (headless), import scan disabled");
                }
            }
            SessionScheduler scheduler = new SessionScheduler(session, importSource, settings);

            List<Controller> controllers = List.of(
                    new SessionController(session, passwordStrength, objectMapper),
                    new CredentialController(session, qrCodeService, objectMapper),
                    new VaultController(session, objectMapper),
                    new GeneratorController(new ManualCodeService(codeGenerator), objectMapper));
            Javalin app = createApp(objectMapper, controllers);

            // A failed unlock ends the application
            session.setTerminationListener(reason -> {
                logger.warn("Terminating: " + reason);
                Thread stopper = new Thread(() -> System.exit(2), "vault-terminator");
                stopper.setDaemon(false);
                stopper.start();
            });

            app.start("127.0.0.1", config.getPort());
            scheduler.start();

            String url = "http://localhost:" + config.getPort() + "/";
            logger.info("Server started on " + url);
            logger.console("");
            logger.console("  Listening on " + url);
            logger.console("  Vault: " + config.getVaultPath());
            logger.console("  Log file: " + config.getLogPath());
            logger.console("");
            logger.console("========================================");
            logger.console("  Press Ctrl+C to stop");
            logger.console("========================================");

            // Add shutdown hook for clean shutdown
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                logger.info("Shutting down...");
                scheduler.stop();
                session.lock();
                app.stop();
                logger.close();
            }));

        } catch (Exception e) {
            System.err.println("Failed to start TokenX: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    private static void printBanner(AppConfig config) {
        logger.console("");
        logger.console("========================================");
        logger.console("  TokenX v" + VERSION);
        logger.console("========================================");
        logger.console("  Starting server...");
        if (config.isDevMode()) {
            logger.console("  Mode: Development");
        }
    }

    /**
     * Builds the unstarted server with every controller's routes and the shared exception handlers.
     */
    static Javalin createApp(ObjectMapper mapper, List<Controller> controllers) {
        Javalin app = Javalin.create(cfg -> {
            cfg.jsonMapper(new JavalinJackson(mapper, false));
            cfg.http.defaultContentType = "application/json";
        });
        controllers.forEach(controller -> controller.registerRoutes(app));
        registerExceptionHandlers(app);
        return app;
    }

    private static void registerExceptionHandlers(Javalin app) {
        app.exception(VaultException.class, (e, ctx) -> {
            if (logger != null) {
                logger.warn("Unhandled vault error: " + e.getKind());
            }
            Controller.fail(ctx, e);
        });

        app.exception(Exception.class, (e, ctx) -> {
            if (logger != null) {
                logger.error("Unhandled exception: " + e.getMessage(), e);
            }
            ctx.status(500).json(Map.of("error", String.valueOf(e.getMessage())));
        });
    }
}
