package com.example.feedpipeline.delivery;

import com.example.feedpipeline.exception.FeedConfigurationException;
import com.example.feedpipeline.model.DeliveryMethod;
import com.example.feedpipeline.model.DeliveryOutcome;
import com.example.feedpipeline.model.FeedDefinition;
import com.example.feedpipeline.model.GenerationRecord;
import com.example.feedpipeline.storage.StorageSink;
import jakarta.mail.internet.MimeMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;
import org.thymeleaf.ITemplateEngine;
import org.thymeleaf.context.Context;

import java.nio.charset.StandardCharsets;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 邮件投递：HTML 正文 + 纯文本备选，小于 10 MiB 的文件作为附件。
 */
@Slf4j
@Component
public class EmailDeliveryHandler extends AbstractDeliveryHandler {

    static final long ATTACHMENT_LIMIT_BYTES = 10L * 1024 * 1024;
    static final String DEFAULT_SUBJECT = "Your {feed_name} is ready";
    private static final String TEMPLATE = "mail/feed-ready";
    private static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd");

    private final JavaMailSender mailSender;
    private final ITemplateEngine templateEngine;
    private final FeedLinks feedLinks;
    private final String fromAddress;

    public EmailDeliveryHandler(StorageSink storageSink, JavaMailSender mailSender, ITemplateEngine templateEngine,
            FeedLinks feedLinks, @Value("${app.feeds.mail.from:feeds@localhost}") String fromAddress) {
        super(storageSink);
        this.mailSender = mailSender;
        this.templateEngine = templateEngine;
        this.feedLinks = feedLinks;
        this.fromAddress = fromAddress;
    }

    @Override
    public DeliveryMethod method() {
        return DeliveryMethod.EMAIL;
    }

    @Override
    protected void checkConfig(FeedDefinition feed, DeliveryConfig config) {
        recipient(feed, config);
    }

    @Override
    protected DeliveryOutcome doDeliver(FeedDefinition feed, GenerationRecord generation, DeliveryConfig config)
            throws Exception {
        String recipient = recipient(feed, config);
        List<String> cc = config.getStringList("cc_emails");
        String subject = subject(config.getString("subject_template", DEFAULT_SUBJECT), feed, generation);
        String downloadUrl = feedLinks.downloadUrl(generation.getGenerationId());
        boolean attach = shouldAttach(generation);

        MimeMessage message = mailSender.createMimeMessage();
        MimeMessageHelper helper = new MimeMessageHelper(message, true, StandardCharsets.UTF_8.name());
        helper.setFrom(fromAddress);
        helper.setTo(recipient);
        if (!cc.isEmpty()) {
            helper.setCc(cc.toArray(new String[0]));
        }
        helper.setSubject(subject);
        helper.setText(plainText(feed, generation, downloadUrl), htmlBody(feed, generation, downloadUrl));
        if (attach) {
            helper.addAttachment(fileName(generation), new ByteArrayResource(readArtifact(generation)));
        }

        mailSender.send(message);
        log.info("Feed {} emailed to {} (attached: {})", feed.getSlug(), recipient, attach);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("recipient", recipient);
        details.put("cc", cc);
        details.put("attached", attach);
        return DeliveryOutcome.success(details);
    }

    private String recipient(FeedDefinition feed, DeliveryConfig config) {
        String recipient = config.getString("email");
        if (recipient == null && feed.getOwner() != null) {
            recipient = feed.getOwner().getEmail();
        }
        if (recipient == null || recipient.isBlank()) {
            throw new FeedConfigurationException("Missing email configuration: no recipient");
        }
        return recipient;
    }

    static boolean shouldAttach(GenerationRecord generation) {
        return generation.getFileSize() != null && generation.getFileSize() < ATTACHMENT_LIMIT_BYTES;
    }

    static String subject(String template, FeedDefinition feed, GenerationRecord generation) {
        String date = generation.getStartedAt() != null ? generation.getStartedAt().format(DATE_FORMATTER) : "";
        return template
                .replace("{feed_name}", feed.getName())
                .replace("{feed_type}", feed.getFeedType().getDisplayName())
                .replace("{date}", date);
    }

    private String htmlBody(FeedDefinition feed, GenerationRecord generation, String downloadUrl) {
        Context context = new Context();
        context.setVariable("feed", feed);
        context.setVariable("generation", generation);
        context.setVariable("owner", feed.getOwner());
        context.setVariable("downloadUrl", downloadUrl);
        return templateEngine.process(TEMPLATE, context);
    }

    private String plainText(FeedDefinition feed, GenerationRecord generation, String downloadUrl) {
        StringBuilder text = new StringBuilder();
        if (feed.getOwner() != null) {
            text.append("Hello ").append(feed.getOwner().displayName()).append(",\n\n");
        }
        text.append("Your feed \"").append(feed.getName()).append("\" has been generated.\n\n");
        text.append("Rows: ").append(generation.getRowCount()).append('\n');
        text.append("Size: ").append(generation.getFileSize()).append(" bytes\n");
        text.append("Download: ").append(downloadUrl).append('\n');
        return text.toString();
    }
}
