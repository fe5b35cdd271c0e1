package io.syncrelay.relay.channel;

/**
 * Derives short queue names from queue URLs and ARNs for logging and response provenance.
 */
public final class QueueNames {

  private QueueNames() {
  }

  /**
   * Short name of a queue configured either as an ARN ({@code arn:...}) or as a URL or plain name.
   */
  public static String of(String queue) {
    if (queue == null || queue.isBlank()) {
      return "";
    }
    return queue.trim().startsWith("arn:") ? fromArn(queue) : fromUrl(queue);
  }

  /**
   * Returns the last path segment of a queue URL with any query string removed, for example
   * {@code https://sqs.eu-west-1.amazonaws.com/123/relay-push?x=1} becomes {@code relay-push}.
   */
  public static String fromUrl(String queueUrl) {
    if (queueUrl == null || queueUrl.isBlank()) {
      return "";
    }
    String base = queueUrl.trim();
    int query = base.indexOf('?');
    if (query >= 0) {
      base = base.substring(0, query);
    }
    while (base.length() > 1 && base.endsWith("/")) {
      base = base.substring(0, base.length() - 1);
    }
    int slash = base.lastIndexOf('/');
    return slash >= 0 ? base.substring(slash + 1) : base;
  }

  /**
   * Returns the last colon separated element of an ARN such as
   * {@code arn:aws:sqs:region:account:queueName}.
   */
  public static String fromArn(String arn) {
    if (arn == null || arn.isBlank()) {
      return "";
    }
    String trimmed = arn.trim();
    int colon = trimmed.lastIndexOf(':');
    return colon >= 0 ? trimmed.substring(colon + 1) : trimmed;
  }
}
