package com.z2api.web.controller;

import com.z2api.pool.service.ChatRelayService;
import com.z2api.upstream.client.UpstreamResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * OpenAI 兼容的对话入口，请求体原样转发给上游。
 */
@RestController
@RequiredArgsConstructor
public class ChatCompletionController {

    private final ChatRelayService relayService;

    @PostMapping(value = "/v1/chat/completions", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<String> chatCompletions(@RequestBody String body) {
        UpstreamResponse response = relayService.relay(body);
        ResponseEntity.BodyBuilder builder = ResponseEntity.status(response.getStatusCode());
        if (response.getContentType() != null) {
            builder.header(HttpHeaders.CONTENT_TYPE, response.getContentType());
        }
        return builder.body(response.getBody());
    }
}
