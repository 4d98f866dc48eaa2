/**
 * <strong>Purpose:</strong> AWS SDK v2 adapters: CloudWatch Logs delivery and Amazon Comprehend text analysis.
 * <p><strong>Pipeline role:</strong> Outermost layer; translates SDK exceptions into the application's checked
 * failure types.
 * <p><strong>Configuration:</strong> Credentials come from the SDK default provider chain; regions and timeouts
 * from the command configuration.
 *
 * @since 0.1.0
 */
package ca.gc.cra.trail.adapter.aws;
