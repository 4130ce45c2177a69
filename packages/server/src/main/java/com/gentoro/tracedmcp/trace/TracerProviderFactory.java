package com.gentoro.tracedmcp.trace;

import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.SpanLimits;
import io.opentelemetry.sdk.trace.SpanProcessor;
import io.opentelemetry.sdk.trace.samplers.Sampler;

/**
 * Builds the {@link SdkTracerProvider} every span of the server is created through.
 *
 * <p>All spans are sampled: the sampled flag of an incoming {@code traceparent} is propagated but
 * does not suppress recording. String attribute values longer than {@code
 * tracing.max-attribute-length} are truncated by the SDK.
 */
public final class TracerProviderFactory {
  private TracerProviderFactory() {}

  /** The default SDK resource (host, OS, etc.) merged with this service's name and version. */
  public static Resource resource(String serviceName, String serviceVersion) {
    return Resource.getDefault()
        .merge(
            Resource.create(
                Attributes.builder()
                    .put(SpanAttributes.SERVICE_NAME, serviceName)
                    .put(SpanAttributes.SERVICE_VERSION, serviceVersion)
                    .build()));
  }

  public static SdkTracerProvider create(
      TracingSettings settings, String serviceVersion, SpanProcessor processor) {
    return SdkTracerProvider.builder()
        .setResource(resource(settings.serviceName(), serviceVersion))
        .setSampler(Sampler.alwaysOn())
        .setSpanLimits(
            SpanLimits.builder()
                .setMaxAttributeValueLength(settings.maxAttributeLength())
                .build())
        .addSpanProcessor(processor)
        .build();
  }
}
