/**
 * JSON adapters built on Jackson.
 *
 * <h2>Run Context</h2>
 * <ul>
 *   <li>{@link com.ryuqq.taskchain.adapter.json.RunContextCodec} - Encodes and decodes a RunContext snapshot</li>
 *   <li>{@link com.ryuqq.taskchain.adapter.json.InvalidContextFormatException} - Decode failure with a named violation</li>
 * </ul>
 *
 * <h2>Workflows</h2>
 * <ul>
 *   <li>{@link com.ryuqq.taskchain.adapter.json.WorkflowAssembler} - Builds a Workflow from a JSON definition and a step registry</li>
 *   <li>{@link com.ryuqq.taskchain.adapter.json.WorkflowManifestWriter} - Renders a WorkflowManifest as JSON</li>
 * </ul>
 *
 * @since 1.0.0
 * @author TaskChain Team
 */
package com.ryuqq.taskchain.adapter.json;
