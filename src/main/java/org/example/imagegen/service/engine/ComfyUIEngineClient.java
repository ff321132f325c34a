package org.example.imagegen.service.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.UUID;

/**
 * HTTP client for a ComfyUI server.
 */
public class ComfyUIEngineClient implements GenerationEngineClient {

  private static final Logger log = LoggerFactory.getLogger(ComfyUIEngineClient.class);

  private final WebClient webClient;
  private final ObjectMapper objectMapper;
  private final Duration requestTimeout;
  private final Duration downloadTimeout;
  private final String clientId;

  public ComfyUIEngineClient(String baseUrl, int requestTimeoutSeconds, int downloadTimeoutSeconds, ObjectMapper objectMapper) {
    // Larger buffer for image downloads (16MB)
    this(WebClient.builder()
            .baseUrl(baseUrl)
            .codecs(configurer -> configurer
                .defaultCodecs()
                .maxInMemorySize(16 * 1024 * 1024))
            .build(),
        requestTimeoutSeconds, downloadTimeoutSeconds, objectMapper);
    log.info("ComfyUI engine client initialized with endpoint: {}", baseUrl);
  }

  ComfyUIEngineClient(WebClient webClient, int requestTimeoutSeconds, int downloadTimeoutSeconds, ObjectMapper objectMapper) {
    this.webClient = webClient;
    this.objectMapper = objectMapper;
    this.requestTimeout = Duration.ofSeconds(Math.max(1, requestTimeoutSeconds));
    this.downloadTimeout = Duration.ofSeconds(Math.max(1, downloadTimeoutSeconds));
    this.clientId = UUID.randomUUID().toString();
  }

  @Override
  public String submit(ObjectNode workflow) throws GenerationEngineException {
    ObjectNode requestBody = objectMapper.createObjectNode();
    requestBody.set("prompt", workflow);
    requestBody.put("client_id", clientId);

    JsonNode responseNode = readTree(post("/prompt", requestBody));
    JsonNode nodeErrors = responseNode.path("node_errors");
    if (responseNode.hasNonNull("error") || (nodeErrors.isObject() && nodeErrors.size() > 0)) {
      throw new EngineFatalException("ComfyUI rejected workflow: " + describeError(responseNode));
    }
    String promptId = responseNode.path("prompt_id").asText(null);
    if (promptId == null || promptId.isBlank()) {
      throw new EngineFatalException("ComfyUI response did not contain a prompt_id");
    }
    log.info("Submitted workflow to ComfyUI, prompt_id: {}", promptId);
    return promptId;
  }

  @Override
  public EnginePollResult poll(String ref) throws GenerationEngineException {
    JsonNode historyNode = readTree(get("/history/" + ref));
    JsonNode promptHistory = historyNode.get(ref);

    if (promptHistory == null || promptHistory.isNull()) {
      // Not in history yet; the queue tells us whether it is still alive.
      JsonNode queueNode = readTree(get("/queue"));
      if (queueContains(queueNode.path("queue_running"), ref)) {
        return EnginePollResult.running();
      }
      if (queueContains(queueNode.path("queue_pending"), ref)) {
        return EnginePollResult.pending();
      }
      return EnginePollResult.unknown();
    }

    JsonNode status = promptHistory.path("status");
    if ("error".equals(status.path("status_str").asText())) {
      String errorMsg = "ComfyUI workflow error";
      if (status.has("messages")) {
        errorMsg = extractExecutionError(status.get("messages"), errorMsg);
      }
      return EnginePollResult.failed(errorMsg);
    }

    List<EngineOutput> outputs = new ArrayList<>();
    JsonNode outputNodes = promptHistory.path("outputs");
    for (JsonNode nodeOutput : outputNodes) {
      JsonNode images = nodeOutput.path("images");
      if (images.isArray()) {
        for (JsonNode imageInfo : images) {
          outputs.add(new EngineOutput(
              imageInfo.path("filename").asText(),
              imageInfo.path("subfolder").asText(""),
              imageInfo.path("type").asText("output")));
        }
      }
    }
    if (!outputs.isEmpty()) {
      return EnginePollResult.completed(outputs);
    }
    if (status.path("completed").asBoolean(false)) {
      return EnginePollResult.failed("ComfyUI finished without producing any images");
    }
    return EnginePollResult.running();
  }

  @Override
  public boolean cancel(String ref) throws GenerationEngineException {
    JsonNode queueNode = readTree(get("/queue"));
    if (queueContains(queueNode.path("queue_running"), ref)) {
      post("/interrupt", objectMapper.createObjectNode());
      log.info("Interrupted running ComfyUI prompt {}", ref);
      return true;
    }
    ObjectNode body = objectMapper.createObjectNode();
    body.putArray("delete").add(ref);
    post("/queue", body);
    log.info("Removed ComfyUI prompt {} from pending queue", ref);
    return true;
  }

  @Override
  public byte[] download(EngineOutput output) throws GenerationEngineException {
    try {
      byte[] imageData = webClient.get()
          .uri(uriBuilder -> uriBuilder.path("/view")
              .queryParam("filename", output.filename())
              .queryParam("subfolder", output.subfolder())
              .queryParam("type", output.type())
              .build())
          .retrieve()
          .bodyToMono(byte[].class)
          .block(downloadTimeout);
      if (imageData == null || imageData.length == 0) {
        throw new EngineFatalException("ComfyUI returned an empty image for " + output.filename());
      }
      return imageData;
    } catch (WebClientResponseException e) {
      throw translate(e);
    } catch (WebClientRequestException e) {
      throw new EngineConnectionException("Failed to reach ComfyUI: " + e.getMessage(), e);
    }
  }

  @Override
  public EngineQueueInfo queueInfo() throws GenerationEngineException {
    JsonNode queueNode = readTree(get("/queue"));
    return EngineQueueInfo.of(queueNode.path("queue_running").size(), queueNode.path("queue_pending").size());
  }

  @Override
  public EngineCapabilities capabilities() throws GenerationEngineException {
    JsonNode objectInfo = readTree(get("/object_info"));
    return new EngineCapabilities(
        firstInputChoices(objectInfo.path("CheckpointLoaderSimple"), "ckpt_name"),
        firstInputChoices(objectInfo.path("LoraLoader"), "lora_name"));
  }

  @Override
  public boolean isAvailable() {
    try {
      webClient.get()
          .uri("/system_stats")
          .retrieve()
          .bodyToMono(String.class)
          .block(Duration.ofSeconds(3));
      return true;
    } catch (Exception e) {
      log.debug("ComfyUI not available: {}", e.getMessage());
      return false;
    }
  }

  @Override
  public String getEngineName() {
    return "comfyui";
  }

  private String get(String uri) throws GenerationEngineException {
    try {
      return webClient.get()
          .uri(uri)
          .retrieve()
          .bodyToMono(String.class)
          .block(requestTimeout);
    } catch (WebClientResponseException e) {
      throw translate(e);
    } catch (WebClientRequestException e) {
      throw new EngineConnectionException("Failed to reach ComfyUI: " + e.getMessage(), e);
    } catch (IllegalStateException e) {
      // block() timeout
      throw new EngineConnectionException("ComfyUI request timed out: " + uri, e);
    }
  }

  private String post(String uri, JsonNode body) throws GenerationEngineException {
    try {
      return webClient.post()
          .uri(uri)
          .contentType(MediaType.APPLICATION_JSON)
          .bodyValue(objectMapper.writeValueAsString(body))
          .retrieve()
          .bodyToMono(String.class)
          .block(requestTimeout);
    } catch (JsonProcessingException e) {
      throw new EngineFatalException("Failed to serialize ComfyUI request body", e);
    } catch (WebClientResponseException e) {
      throw translate(e);
    } catch (WebClientRequestException e) {
      throw new EngineConnectionException("Failed to reach ComfyUI: " + e.getMessage(), e);
    } catch (IllegalStateException e) {
      throw new EngineConnectionException("ComfyUI request timed out: " + uri, e);
    }
  }

  private GenerationEngineException translate(WebClientResponseException e) {
    String body = e.getResponseBodyAsString();
    if (e.getStatusCode().is5xxServerError()) {
      return new EngineConnectionException("ComfyUI server error " + e.getStatusCode().value() + ": " + body, e);
    }
    String detail = body;
    try {
      if (body != null && !body.isBlank()) {
        detail = describeError(objectMapper.readTree(body));
      }
    } catch (JsonProcessingException parseFailure) {
      log.debug("ComfyUI error body is not JSON: {}", parseFailure.getMessage());
    }
    return new EngineFatalException("ComfyUI rejected request (" + e.getStatusCode().value() + "): " + detail, e);
  }

  private JsonNode readTree(String response) throws GenerationEngineException {
    if (response == null || response.isBlank()) {
      return objectMapper.createObjectNode();
    }
    try {
      return objectMapper.readTree(response);
    } catch (JsonProcessingException e) {
      throw new EngineConnectionException("Malformed response from ComfyUI", e);
    }
  }

  private static boolean queueContains(JsonNode queue, String ref) {
    // Queue entries are arrays: [number, prompt_id, prompt, extra_data, outputs]
    for (JsonNode entry : queue) {
      if (entry.isArray() && entry.size() > 1 && ref.equals(entry.get(1).asText())) {
        return true;
      }
    }
    return false;
  }

  private static String describeError(JsonNode responseNode) {
    JsonNode error = responseNode.path("error");
    if (error.isObject()) {
      String message = error.path("message").asText("");
      String details = error.path("details").asText("");
      if (!details.isBlank()) {
        return message + ": " + details;
      }
      if (!message.isBlank()) {
        return message;
      }
    } else if (error.isTextual()) {
      return error.asText();
    }
    JsonNode nodeErrors = responseNode.path("node_errors");
    if (nodeErrors.isObject() && nodeErrors.size() > 0) {
      return nodeErrors.toString();
    }
    return responseNode.toString();
  }

  private static String extractExecutionError(JsonNode messages, String fallback) {
    // messages: [["execution_error", {"exception_message": ...}], ...]
    for (JsonNode message : messages) {
      if (message.isArray() && message.size() > 1 && "execution_error".equals(message.get(0).asText())) {
        String text = message.get(1).path("exception_message").asText("");
        if (!text.isBlank()) {
          return text.trim();
        }
      }
    }
    return messages.isEmpty() ? fallback : messages.toString();
  }

  private static List<String> firstInputChoices(JsonNode nodeInfo, String inputName) {
    List<String> values = new ArrayList<>();
    JsonNode choices = nodeInfo.path("input").path("required").path(inputName).path(0);
    Iterator<JsonNode> iterator = choices.elements();
    while (iterator.hasNext()) {
      values.add(iterator.next().asText());
    }
    return values;
  }
}
