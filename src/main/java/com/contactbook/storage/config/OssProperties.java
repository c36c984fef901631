package com.contactbook.storage.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "oss")
public class OssProperties {

    private String endpoint;
    private String accessKeyId;
    private String accessKeySecret;
    private String bucket;
    private String folder = "avatars";
    /**
     * 自定义访问域名（CDN），为空时使用 bucket 默认域名。
     */
    private String publicDomain;
}
