package com.contactbook.storage;

import com.aliyun.oss.ClientException;
import com.aliyun.oss.OSS;
import com.aliyun.oss.OSSClientBuilder;
import com.aliyun.oss.OSSException;
import com.aliyun.oss.model.ObjectMetadata;
import com.aliyun.oss.model.PutObjectRequest;
import com.contactbook.common.exception.BusinessException;
import com.contactbook.common.exception.ErrorCode;
import com.contactbook.storage.config.OssProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.time.Clock;

/**
 * 头像上传到对象存储。
 * <p>
 * 每个用户使用固定对象键，重复上传直接覆盖；返回的访问地址带版本参数，便于客户端刷新缓存。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AvatarStorageService {

    private final OssProperties props;
    private final Clock clock;

    public String uploadAvatar(long userId, MultipartFile file) {
        ensureConfigured();
        if (file == null || file.isEmpty()) {
            throw new BusinessException(ErrorCode.BAD_REQUEST, "Avatar file is empty");
        }
        String objectKey = objectKey(userId);

        OSS client = new OSSClientBuilder().build(props.getEndpoint(), props.getAccessKeyId(), props.getAccessKeySecret());
        try {
            ObjectMetadata metadata = new ObjectMetadata();
            if (file.getContentType() != null) {
                metadata.setContentType(file.getContentType());
            }
            PutObjectRequest request = new PutObjectRequest(props.getBucket(), objectKey, file.getInputStream(), metadata);
            client.putObject(request);
        } catch (IOException e) {
            throw new BusinessException(ErrorCode.BAD_REQUEST, "Failed to read avatar file");
        } catch (OSSException | ClientException e) {
            log.error("Avatar upload failed userId={} key={}", userId, objectKey, e);
            throw new IllegalStateException("Avatar upload failed", e);
        } finally {
            client.shutdown();
        }

        return publicUrl(objectKey) + "?v=" + clock.millis();
    }

    String objectKey(long userId) {
        String folder = props.getFolder() == null ? "" : props.getFolder().replaceAll("^/+|/+$", "");
        return folder.isEmpty() ? "avatar-" + userId : folder + "/avatar-" + userId;
    }

    String publicUrl(String objectKey) {
        if (StringUtils.hasText(props.getPublicDomain())) {
            return props.getPublicDomain().replaceAll("/$", "") + "/" + objectKey;
        }
        return "https://" + props.getBucket() + "." + props.getEndpoint() + "/" + objectKey;
    }

    private void ensureConfigured() {
        if (!StringUtils.hasText(props.getEndpoint()) || !StringUtils.hasText(props.getAccessKeyId())
                || !StringUtils.hasText(props.getAccessKeySecret()) || !StringUtils.hasText(props.getBucket())) {
            throw new BusinessException(ErrorCode.BAD_REQUEST, "Object storage is not configured");
        }
    }
}
