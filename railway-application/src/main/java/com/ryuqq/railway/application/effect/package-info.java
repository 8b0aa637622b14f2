/**
 * Effect layer: execution metadata and pluggable side-effect providers.
 *
 * <p>{@link com.ryuqq.railway.application.effect.EffectWorkflow} drives an
 * {@link com.ryuqq.railway.application.effect.EffectRunner}, which fans every call out to the enabled
 * {@link com.ryuqq.railway.application.effect.EffectProvider}s with per-provider fault isolation.</p>
 */
package com.ryuqq.railway.application.effect;
