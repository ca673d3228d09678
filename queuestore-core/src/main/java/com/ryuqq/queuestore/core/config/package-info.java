/**
 * 큐 저장소 설정.
 *
 * @since 1.0.0
 */
package com.ryuqq.queuestore.core.config;
