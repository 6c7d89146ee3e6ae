/**
 * 레이트 리미터 구현 패키지 (Token Bucket, Sliding Window, Leaky Bucket).
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.adapter.inmemory.ratelimit;
