package com.warden.security.mfa;

import com.warden.security.SecureTokens;
import com.warden.security.notify.NotificationChannel;
import com.warden.security.notify.NotificationSender;
import com.warden.security.user.User;
import dev.samstevens.totp.code.CodeGenerator;
import dev.samstevens.totp.code.CodeVerifier;
import dev.samstevens.totp.code.DefaultCodeGenerator;
import dev.samstevens.totp.code.DefaultCodeVerifier;
import dev.samstevens.totp.code.HashingAlgorithm;
import dev.samstevens.totp.exceptions.CodeGenerationException;
import dev.samstevens.totp.exceptions.QrGenerationException;
import dev.samstevens.totp.qr.QrData;
import dev.samstevens.totp.qr.QrGenerator;
import dev.samstevens.totp.qr.ZxingPngQrGenerator;
import dev.samstevens.totp.secret.DefaultSecretGenerator;
import dev.samstevens.totp.secret.SecretGenerator;
import dev.samstevens.totp.time.TimeProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

import static dev.samstevens.totp.util.Utils.getDataUriForImage;

/**
 * TOTP enrollment and verification, plus single-use backup codes.
 * <p>
 * Codes are 6 digits over 30 second periods with HMAC-SHA1, and one period of drift is
 * tolerated in each direction. The current time comes from the injected {@link Clock}.
 * <p>
 * SMS and EMAIL are placeholders: enrollment sends a notice through the
 * {@link NotificationSender} and any 6-digit code is accepted.
 * <p>
 * Methods that change enrollment state mutate the given {@link User}; the caller persists it.
 */
public class MfaService {

    private static final Logger log = LoggerFactory.getLogger(MfaService.class);

    public static final int DIGITS = 6;
    public static final int PERIOD_SECONDS = 30;
    public static final int ALLOWED_DRIFT_PERIODS = 1;
    public static final int BACKUP_CODE_COUNT = 10;

    private static final int BACKUP_CODE_BYTES = 4;
    private static final Pattern SIX_DIGITS = Pattern.compile("\\d{6}");

    private final String issuer;
    private final NotificationSender notifications;
    private final SecretGenerator secretGenerator = new DefaultSecretGenerator();
    private final CodeGenerator codeGenerator = new DefaultCodeGenerator(HashingAlgorithm.SHA1, DIGITS);
    private final QrGenerator qrGenerator = new ZxingPngQrGenerator();
    private final CodeVerifier verifier;

    public MfaService(Clock clock, String issuer, NotificationSender notifications) {
        if (issuer == null || issuer.isBlank()) {
            throw new IllegalArgumentException("issuer must not be blank");
        }
        this.issuer = issuer;
        this.notifications = notifications;
        TimeProvider timeProvider = () -> clock.instant().getEpochSecond();
        DefaultCodeVerifier codeVerifier = new DefaultCodeVerifier(codeGenerator, timeProvider);
        codeVerifier.setTimePeriod(PERIOD_SECONDS);
        codeVerifier.setAllowedTimePeriodDiscrepancy(ALLOWED_DRIFT_PERIODS);
        this.verifier = codeVerifier;
    }

    /**
     * Starts (or restarts) enrollment. A TOTP secret is stored as pending until
     * {@link #confirmSetup} succeeds; backup codes are replaced immediately.
     *
     * @param phoneNumber required for SMS, ignored otherwise
     */
    public MfaSetupResult setup(User user, MfaMethod method, String phoneNumber) {
        List<String> backupCodes = newBackupCodes();
        Set<String> hashes = new LinkedHashSet<>();
        backupCodes.forEach(code -> hashes.add(SecureTokens.sha256(code)));

        switch (method) {
            case TOTP -> {
                String secret = secretGenerator.generate();
                QrData data = new QrData.Builder()
                        .label(user.getEmail())
                        .secret(secret)
                        .issuer(issuer)
                        .algorithm(HashingAlgorithm.SHA1)
                        .digits(DIGITS)
                        .period(PERIOD_SECONDS)
                        .build();
                String qrCode = renderQrCode(data);
                user.setPendingMfaSecret(secret);
                user.setBackupCodeHashes(hashes);
                log.debug("TOTP enrollment started for user {}", user.getId());
                return new MfaSetupResult(method, secret, data.getUri(), qrCode, backupCodes);
            }
            case SMS -> {
                if (phoneNumber == null || phoneNumber.isBlank()) {
                    throw new IllegalArgumentException("Phone number is required for SMS MFA");
                }
                user.setMfaPhoneNumber(phoneNumber.strip());
                user.setBackupCodeHashes(hashes);
                notifications.send(NotificationChannel.SMS, phoneNumber.strip(),
                        issuer + " MFA enrollment", "Reply with the 6-digit code to confirm SMS verification.");
                return new MfaSetupResult(method, null, null, null, backupCodes);
            }
            case EMAIL -> {
                user.setBackupCodeHashes(hashes);
                notifications.send(NotificationChannel.EMAIL, user.getEmail(),
                        issuer + " MFA enrollment", "Enter the 6-digit code to confirm email verification.");
                return new MfaSetupResult(method, null, null, null, backupCodes);
            }
            default -> throw new IllegalArgumentException("Unsupported MFA method: " + method);
        }
    }

    /**
     * Verifies a code for an enrolled user at login.
     */
    public boolean verify(User user, String code, MfaMethod method) {
        if (method == MfaMethod.TOTP) {
            return verifyTotp(user.getMfaSecret(), code);
        }
        return isSixDigits(code);
    }

    /**
     * Confirms a pending enrollment. On success MFA is enabled for {@code method} and a pending
     * TOTP secret becomes the active one.
     */
    public boolean confirmSetup(User user, String code, MfaMethod method) {
        boolean valid;
        if (method == MfaMethod.TOTP) {
            String secret = user.getPendingMfaSecret() != null ? user.getPendingMfaSecret() : user.getMfaSecret();
            valid = verifyTotp(secret, code);
            if (valid && user.getPendingMfaSecret() != null) {
                user.setMfaSecret(user.getPendingMfaSecret());
                user.setPendingMfaSecret(null);
            }
        } else {
            valid = isSixDigits(code);
        }
        if (valid) {
            Set<MfaMethod> methods = new LinkedHashSet<>(user.getMfaMethods());
            methods.add(method);
            user.setMfaMethods(methods);
            user.setMfaEnabled(true);
        }
        return valid;
    }

    /**
     * Removes every MFA factor and backup code from the user.
     */
    public void disable(User user) {
        user.setMfaEnabled(false);
        user.setMfaSecret(null);
        user.setPendingMfaSecret(null);
        user.setMfaMethods(Set.of());
        user.setMfaPhoneNumber(null);
        user.setBackupCodeHashes(Set.of());
    }

    /**
     * @return the stored hash matching {@code code}; the caller removes it to consume the code
     */
    public Optional<String> matchBackupCode(User user, String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        String hash = SecureTokens.sha256(code.strip().toUpperCase(Locale.ROOT));
        return user.getBackupCodeHashes().contains(hash) ? Optional.of(hash) : Optional.empty();
    }

    /**
     * The code a TOTP app would show for {@code secret} at {@code at}.
     */
    public String generateCode(String secret, Instant at) {
        try {
            return codeGenerator.generate(secret, Math.floorDiv(at.getEpochSecond(), PERIOD_SECONDS));
        } catch (CodeGenerationException e) {
            throw new MfaException("Failed to generate TOTP code", e);
        }
    }

    private boolean verifyTotp(String secret, String code) {
        if (secret == null || !isSixDigits(code)) {
            return false;
        }
        return verifier.isValidCode(secret, code.strip());
    }

    private String renderQrCode(QrData data) {
        try {
            return getDataUriForImage(qrGenerator.generate(data), qrGenerator.getImageMimeType());
        } catch (QrGenerationException e) {
            throw new MfaException("Failed to render TOTP QR code", e);
        }
    }

    private static List<String> newBackupCodes() {
        List<String> codes = new ArrayList<>(BACKUP_CODE_COUNT);
        for (int i = 0; i < BACKUP_CODE_COUNT; i++) {
            codes.add(SecureTokens.hexCode(BACKUP_CODE_BYTES));
        }
        return codes;
    }

    private static boolean isSixDigits(String code) {
        return code != null && SIX_DIGITS.matcher(code.strip()).matches();
    }
}
