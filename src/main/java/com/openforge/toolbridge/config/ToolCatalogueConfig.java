package com.openforge.toolbridge.config;

import com.openforge.toolbridge.adapter.JsonPlaceholderCommentsAdapter;
import com.openforge.toolbridge.adapter.JsonPlaceholderPostAdapter;
import com.openforge.toolbridge.adapter.JsonPlaceholderProperties;
import com.openforge.toolbridge.tool.ArgumentSpec;
import com.openforge.toolbridge.tool.ToolRegistry;
import com.openforge.toolbridge.tool.ToolSpec;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;

/**
 * The tool catalogue, registered once while the context starts.
 *
 *   post_call      {"post_id": <integer>}  → GET /posts/{id}
 *   comments_call  {"post_id": <integer>}  → GET /comments?postId={id}
 *
 * post_id is a reference argument of kind "post", so "that post" in a follow-up
 * resolves to the last post fetched in the session.
 */
@Configuration
@EnableConfigurationProperties(JsonPlaceholderProperties.class)
public class ToolCatalogueConfig {

    public static final String POST_ID = "post_id";

    @Bean
    public ToolRegistry toolRegistry(JsonPlaceholderPostAdapter postAdapter,
                                     JsonPlaceholderCommentsAdapter commentsAdapter) {
        ToolRegistry registry = new ToolRegistry();
        registry.register(new ToolSpec(
                postAdapter.toolName(),
                "Fetch a post",
                Map.of(POST_ID, ArgumentSpec.entityId("post")),
                POST_ID,
                postAdapter));
        registry.register(new ToolSpec(
                commentsAdapter.toolName(),
                "Fetch comments for a post",
                Map.of(POST_ID, ArgumentSpec.entityId("post")),
                POST_ID,
                commentsAdapter));
        return registry;
    }
}
