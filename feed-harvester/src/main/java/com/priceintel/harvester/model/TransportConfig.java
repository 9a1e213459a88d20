package com.priceintel.harvester.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * How a feed's content is retrieved. Which fields apply depends on {@link #kind}:
 * HTTP kinds use url, FTP kinds use host/port/path, push uploads use none of them.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransportConfig {

    private TransportKind kind;
    private String url;
    private String host;
    private Integer port;
    private String path;
    private String username;
    private String password;
    private Long maxFileSizeBytes;      // null → harvester default
}
