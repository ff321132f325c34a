package org.example.imagegen.service.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ComfyUIEngineClientTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final List<String> requests = new ArrayList<>();

    @Test
    void submit_returnsPromptId() throws Exception {
        ComfyUIEngineClient client = client(request -> json(HttpStatus.OK,
                "{\"prompt_id\":\"ref-1\",\"number\":3,\"node_errors\":{}}"));

        String ref = client.submit(objectMapper.createObjectNode());

        assertEquals("ref-1", ref);
        assertEquals(List.of("POST /prompt"), requests);
    }

    @Test
    void submit_withNodeErrors_isFatal() {
        ComfyUIEngineClient client = client(request -> json(HttpStatus.OK,
                "{\"prompt_id\":\"ref-1\",\"node_errors\":{\"4\":{\"errors\":[{\"message\":\"Value not in list\"}]}}}"));

        assertThrows(EngineFatalException.class, () -> client.submit(objectMapper.createObjectNode()));
    }

    @Test
    void submit_mapsHttpErrorsToTransientOrFatal() {
        ComfyUIEngineClient serverError = client(request -> json(HttpStatus.BAD_GATEWAY, "{}"));
        assertThrows(EngineConnectionException.class, () -> serverError.submit(objectMapper.createObjectNode()));

        ComfyUIEngineClient badRequest = client(request -> json(HttpStatus.BAD_REQUEST,
                "{\"error\":{\"message\":\"Prompt outputs failed validation\",\"details\":\"ckpt_name not in list\"}}"));
        EngineFatalException error = assertThrows(EngineFatalException.class,
                () -> badRequest.submit(objectMapper.createObjectNode()));
        assertTrue(error.getMessage().contains("Prompt outputs failed validation: ckpt_name not in list"));
    }

    @Test
    void poll_collectsImagesFromHistory() throws Exception {
        ComfyUIEngineClient client = client(request -> json(HttpStatus.OK, """
                {"ref-1": {
                  "status": {"status_str": "success", "completed": true, "messages": []},
                  "outputs": {"9": {"images": [
                    {"filename": "gen_job1_00001_.png", "subfolder": "", "type": "output"},
                    {"filename": "gen_job1_00002_.png", "subfolder": "batch", "type": "output"}
                  ]}}
                }}
                """));

        EnginePollResult result = client.poll("ref-1");

        assertEquals(EngineJobState.COMPLETED, result.state());
        assertEquals(2, result.outputs().size());
        assertEquals("batch", result.outputs().get(1).subfolder());
        assertEquals(List.of("GET /history/ref-1"), requests);
    }

    @Test
    void poll_reportsExecutionError() throws Exception {
        ComfyUIEngineClient client = client(request -> json(HttpStatus.OK, """
                {"ref-1": {
                  "status": {"status_str": "error", "completed": false, "messages": [
                    ["execution_start", {"prompt_id": "ref-1"}],
                    ["execution_error", {"prompt_id": "ref-1", "exception_message": "CUDA out of memory. "}]
                  ]},
                  "outputs": {}
                }}
                """));

        EnginePollResult result = client.poll("ref-1");

        assertEquals(EngineJobState.FAILED, result.state());
        assertEquals("CUDA out of memory.", result.errorMessage());
    }

    @Test
    void poll_fallsBackToQueueWhenHistoryIsEmpty() throws Exception {
        ComfyUIEngineClient client = client(request -> {
            if (request.url().getPath().startsWith("/history")) {
                return json(HttpStatus.OK, "{}");
            }
            return json(HttpStatus.OK,
                    "{\"queue_running\":[[1,\"ref-running\",{},{},[]]],\"queue_pending\":[[2,\"ref-pending\",{},{},[]]]}");
        });

        assertEquals(EngineJobState.RUNNING, client.poll("ref-running").state());
        assertEquals(EngineJobState.PENDING, client.poll("ref-pending").state());
        assertEquals(EngineJobState.UNKNOWN, client.poll("ref-gone").state());
    }

    @Test
    void cancel_interruptsRunningPromptAndDeletesPendingOne() throws Exception {
        ComfyUIEngineClient client = client(request -> json(HttpStatus.OK,
                "{\"queue_running\":[[1,\"ref-running\",{},{},[]]],\"queue_pending\":[]}"));

        assertTrue(client.cancel("ref-running"));
        assertTrue(client.cancel("ref-pending"));

        assertEquals(List.of("GET /queue", "POST /interrupt", "GET /queue", "POST /queue"), requests);
    }

    @Test
    void download_readsViewEndpoint() throws Exception {
        ComfyUIEngineClient client = client(request -> ClientResponse.create(HttpStatus.OK)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.IMAGE_PNG_VALUE)
                .body("PNGDATA")
                .build());

        byte[] bytes = client.download(new EngineOutput("gen_job1_00001_.png", "", "output"));

        assertArrayEquals("PNGDATA".getBytes(), bytes);
        assertEquals(List.of("GET /view"), requests);
    }

    @Test
    void capabilitiesAndQueueInfo_parseEngineMetadata() throws Exception {
        ComfyUIEngineClient client = client(request -> {
            if (request.url().getPath().equals("/object_info")) {
                return json(HttpStatus.OK, """
                        {"CheckpointLoaderSimple": {"input": {"required": {"ckpt_name": [["a.safetensors", "b.ckpt"]]}}},
                         "LoraLoader": {"input": {"required": {"lora_name": [["detail.safetensors"]]}}}}
                        """);
            }
            return json(HttpStatus.OK, "{\"queue_running\":[[1,\"r\",{},{},[]]],\"queue_pending\":[[2,\"p\"],[3,\"q\"]]}");
        });

        EngineCapabilities capabilities = client.capabilities();
        EngineQueueInfo queueInfo = client.queueInfo();

        assertEquals(List.of("a.safetensors", "b.ckpt"), capabilities.checkpoints());
        assertEquals(List.of("detail.safetensors"), capabilities.loras());
        assertEquals(1, queueInfo.running());
        assertEquals(2, queueInfo.pending());
    }

    @Test
    void isAvailable_falseOnServerError() {
        ComfyUIEngineClient client = client(request -> json(HttpStatus.SERVICE_UNAVAILABLE, "{}"));

        assertFalse(client.isAvailable());
        assertEquals("comfyui", client.getEngineName());
    }

    private ComfyUIEngineClient client(Function<ClientRequest, ClientResponse> responder) {
        WebClient webClient = WebClient.builder()
                .baseUrl("http://comfyui.test")
                .exchangeFunction(request -> {
                    requests.add(request.method().name() + " " + request.url().getPath());
                    return Mono.just(responder.apply(request));
                })
                .build();
        return new ComfyUIEngineClient(webClient, 5, 5, objectMapper);
    }

    private static ClientResponse json(HttpStatus status, String body) {
        return ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build();
    }
}
