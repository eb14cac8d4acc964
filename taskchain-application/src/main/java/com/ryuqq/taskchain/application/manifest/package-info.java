/**
 * Structural summaries of workflows.
 *
 * @since 1.0.0
 * @author TaskChain Team
 */
package com.ryuqq.taskchain.application.manifest;
