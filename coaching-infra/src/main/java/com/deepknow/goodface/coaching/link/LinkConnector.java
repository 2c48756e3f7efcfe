package com.deepknow.goodface.coaching.link;

import java.net.URI;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

public interface LinkConnector {
    CompletableFuture<LinkSocket> connect(URI uri, Map<String, String> headers, LinkSocketListener listener);
}
