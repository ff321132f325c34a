package org.example.imagegen.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.example.imagegen.model.WorkflowParameters;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Builds ComfyUI API-format workflow graphs.
 *
 * <p>Node layout: 4 checkpoint loader, 10.. LoRA chain, 6/7 prompt encoders,
 * 5 empty latent, 3 KSampler, 8 VAE decode, 9 SaveImage.
 */
@Service
public class WorkflowBuilder {

  static final String CHECKPOINT_NODE = "4";
  static final String SAVE_IMAGE_NODE = "9";
  static final int FIRST_LORA_NODE = 10;

  private final ObjectMapper objectMapper;
  private final int defaultSteps;
  private final double defaultCfg;
  private final String defaultSampler;
  private final String defaultScheduler;
  private final String defaultNegativePrompt;

  public WorkflowBuilder(
      ObjectMapper objectMapper,
      @Value("${generation.workflow.default-steps:20}") int defaultSteps,
      @Value("${generation.workflow.default-cfg:7.0}") double defaultCfg,
      @Value("${generation.workflow.default-sampler:euler}") String defaultSampler,
      @Value("${generation.workflow.default-scheduler:normal}") String defaultScheduler,
      @Value("${generation.workflow.default-negative-prompt:text, watermark, blurry, bad quality, deformed, low resolution}")
      String defaultNegativePrompt) {
    this.objectMapper = objectMapper;
    this.defaultSteps = defaultSteps;
    this.defaultCfg = defaultCfg;
    this.defaultSampler = defaultSampler;
    this.defaultScheduler = defaultScheduler;
    this.defaultNegativePrompt = defaultNegativePrompt;
  }

  public ObjectNode build(WorkflowParameters params) {
    ObjectNode workflow = objectMapper.createObjectNode();

    ObjectNode checkpointInputs = objectMapper.createObjectNode();
    checkpointInputs.put("ckpt_name", params.checkpointFilename());
    workflow.set(CHECKPOINT_NODE, node("CheckpointLoaderSimple", checkpointInputs));

    // LoRA loaders chain model and clip from the checkpoint through each other
    String modelSource = CHECKPOINT_NODE;
    String clipSource = CHECKPOINT_NODE;
    int nodeId = FIRST_LORA_NODE;
    for (WorkflowParameters.ResolvedLora lora : params.loras()) {
      ObjectNode loraInputs = objectMapper.createObjectNode();
      loraInputs.put("lora_name", lora.filename());
      loraInputs.put("strength_model", lora.strengthModel());
      loraInputs.put("strength_clip", lora.strengthClip());
      loraInputs.set("model", link(modelSource, 0));
      loraInputs.set("clip", link(clipSource, 1));
      String id = String.valueOf(nodeId++);
      workflow.set(id, node("LoraLoader", loraInputs));
      modelSource = id;
      clipSource = id;
    }

    ObjectNode latentInputs = objectMapper.createObjectNode();
    latentInputs.put("width", params.width());
    latentInputs.put("height", params.height());
    latentInputs.put("batch_size", params.batchSize());
    workflow.set("5", node("EmptyLatentImage", latentInputs));

    ObjectNode positiveInputs = objectMapper.createObjectNode();
    positiveInputs.put("text", params.prompt());
    positiveInputs.set("clip", link(clipSource, 1));
    workflow.set("6", node("CLIPTextEncode", positiveInputs));

    ObjectNode negativeInputs = objectMapper.createObjectNode();
    String negative = params.negativePrompt() == null || params.negativePrompt().isBlank()
        ? defaultNegativePrompt
        : params.negativePrompt();
    negativeInputs.put("text", negative);
    negativeInputs.set("clip", link(clipSource, 1));
    workflow.set("7", node("CLIPTextEncode", negativeInputs));

    Map<String, Object> sampler = params.samplerParams();
    ObjectNode samplerInputs = objectMapper.createObjectNode();
    samplerInputs.put("seed", longParam(sampler, "seed", ThreadLocalRandom.current().nextLong() & Long.MAX_VALUE));
    samplerInputs.put("steps", intParam(sampler, "steps", defaultSteps));
    samplerInputs.put("cfg", doubleParam(sampler, "cfg", defaultCfg));
    samplerInputs.put("sampler_name", stringParam(sampler, "sampler_name", defaultSampler));
    samplerInputs.put("scheduler", stringParam(sampler, "scheduler", defaultScheduler));
    samplerInputs.put("denoise", doubleParam(sampler, "denoise", 1.0));
    samplerInputs.set("model", link(modelSource, 0));
    samplerInputs.set("positive", link("6", 0));
    samplerInputs.set("negative", link("7", 0));
    samplerInputs.set("latent_image", link("5", 0));
    workflow.set("3", node("KSampler", samplerInputs));

    ObjectNode decodeInputs = objectMapper.createObjectNode();
    decodeInputs.set("samples", link("3", 0));
    decodeInputs.set("vae", link(CHECKPOINT_NODE, 2));
    workflow.set("8", node("VAEDecode", decodeInputs));

    ObjectNode saveInputs = objectMapper.createObjectNode();
    saveInputs.put("filename_prefix", params.filenamePrefix());
    saveInputs.set("images", link("8", 0));
    workflow.set(SAVE_IMAGE_NODE, node("SaveImage", saveInputs));

    return workflow;
  }

  /**
   * Per-job SaveImage prefix. Keeps engine output names unique across jobs.
   */
  public static String filenamePrefixFor(String jobId) {
    return "gen_" + jobId.replaceAll("[^A-Za-z0-9]", "");
  }

  private ObjectNode node(String classType, ObjectNode inputs) {
    ObjectNode node = objectMapper.createObjectNode();
    node.put("class_type", classType);
    node.set("inputs", inputs);
    return node;
  }

  private ArrayNode link(String nodeId, int outputIndex) {
    ArrayNode link = objectMapper.createArrayNode();
    link.add(nodeId).add(outputIndex);
    return link;
  }

  private static long longParam(Map<String, Object> params, String key, long fallback) {
    Object value = params.get(key);
    if (value instanceof Number number && number.longValue() >= 0) {
      return number.longValue();
    }
    if (value instanceof String text) {
      try {
        long parsed = Long.parseLong(text.trim());
        return parsed >= 0 ? parsed : fallback;
      } catch (NumberFormatException e) {
        return fallback;
      }
    }
    return fallback;
  }

  private static int intParam(Map<String, Object> params, String key, int fallback) {
    Object value = params.get(key);
    if (value instanceof Number number && number.intValue() > 0) {
      return number.intValue();
    }
    if (value instanceof String text) {
      try {
        int parsed = Integer.parseInt(text.trim());
        return parsed > 0 ? parsed : fallback;
      } catch (NumberFormatException e) {
        return fallback;
      }
    }
    return fallback;
  }

  private static double doubleParam(Map<String, Object> params, String key, double fallback) {
    Object value = params.get(key);
    if (value instanceof Number number) {
      return number.doubleValue();
    }
    if (value instanceof String text) {
      try {
        return Double.parseDouble(text.trim());
      } catch (NumberFormatException e) {
        return fallback;
      }
    }
    return fallback;
  }

  private static String stringParam(Map<String, Object> params, String key, String fallback) {
    Object value = params.get(key);
    if (value instanceof String text && !text.isBlank()) {
      return text.trim();
    }
    return fallback;
  }
}
