package com.contactbook.auth.notification;

import com.contactbook.auth.config.AuthProperties;
import com.contactbook.auth.token.JwtService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 开发/测试用确认邮件发送器。
 * <p>
 * 生成确认令牌并拼出确认链接，不实际发信，仅记录日志。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LoggingConfirmationSender implements ConfirmationSender {

    private final JwtService jwtService;
    private final AuthProperties properties;

    @Override
    public void send(ConfirmationNotice notice) {
        String link = confirmationLink(notice);
        log.info("Send confirmation email to={} username={} link={}", notice.email(), notice.username(), link);
    }

    String confirmationLink(ConfirmationNotice notice) {
        String token = jwtService.createEmailToken(notice.email());
        String base = notice.baseUrl() == null ? "" : notice.baseUrl().replaceAll("/+$", "");
        String path = properties.getConfirmation().getPath();
        if (!path.startsWith("/")) {
            path = "/" + path;
        }
        if (!path.endsWith("/")) {
            path = path + "/";
        }
        return base + path + token;
    }
}
