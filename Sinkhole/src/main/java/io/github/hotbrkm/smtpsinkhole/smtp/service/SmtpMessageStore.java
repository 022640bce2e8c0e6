package io.github.hotbrkm.smtpsinkhole.smtp.service;

import io.github.hotbrkm.smtpsinkhole.smtp.properties.SinkholeSmtpProperties;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.UUID;

/**
 * Writes received messages to disk, one file per accepted recipient.
 * <p>
 * Messages go to the configured inbox directory, or to the directory named by a
 * rule's {@code savedir} option.
 * </p>
 */
@Slf4j
@Component
public class SmtpMessageStore {

    private static final DateTimeFormatter FILE_NAME_FORMATTER = DateTimeFormatter.ofPattern("yyyyMMddHHmmssSSS");

    private final SinkholeSmtpProperties properties;
    private final Path inboxDirectory;

    public SmtpMessageStore(SinkholeSmtpProperties properties) {
        this.properties = properties;
        this.inboxDirectory = resolveInboxDirectory(properties);
    }

    @PostConstruct
    void prepareInboxDirectory() {
        if (!properties.isStoreMessages()) {
            log.info("SMTP message storage is disabled.");
            return;
        }

        try {
            Files.createDirectories(inboxDirectory);
            log.info("SMTP inbox directory initialized at {}", inboxDirectory.toAbsolutePath());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create SMTP inbox directory: " + inboxDirectory, e);
        }
    }

    /**
     * Whether a message would be written anywhere.
     *
     * @param savedir directory from a rule's savedir option, may be null
     * @return true if the message gets stored
     */
    public boolean isStoring(String savedir) {
        return StringUtils.hasText(savedir) || properties.isStoreMessages();
    }

    public Path store(String from, String recipient, InputStream data, String savedir) throws IOException {
        if (!isStoring(savedir)) {
            data.transferTo(OutputStream.nullOutputStream());
            return null;
        }

        Path directory = StringUtils.hasText(savedir) ? Paths.get(savedir) : inboxDirectory;
        Files.createDirectories(directory);
        Path messagePath = directory.resolve(generateFileName(recipient));
        try (OutputStream outputStream = Files.newOutputStream(messagePath, StandardOpenOption.CREATE_NEW)) {
            data.transferTo(outputStream);
        }

        log.info("SMTP mail received - from: {}, to: {}, stored: {}", from, recipient, messagePath.toAbsolutePath());
        return messagePath;
    }

    private Path resolveInboxDirectory(SinkholeSmtpProperties properties) {
        String inboxDir = properties.getInboxDirectory();
        if (!StringUtils.hasText(inboxDir)) {
            if (properties.isStoreMessages()) {
                throw new IllegalStateException("Property 'sinkhole.smtp.inbox-directory' is required.");
            }
            return null;
        }
        return Paths.get(inboxDir);
    }

    private String generateFileName(String recipient) {
        String sanitizedRecipient = recipient == null ? "unknown" : recipient.replaceAll("[^a-zA-Z0-9@._-]", "_");
        String timestamp = FILE_NAME_FORMATTER.format(LocalDateTime.now());
        String unique = UUID.randomUUID().toString().substring(0, 8);
        return timestamp + "-" + sanitizedRecipient + "-" + unique + ".eml";
    }
}
