/**
 * In-memory ProgressStore 어댑터.
 *
 * <p>테스트와 dry-run용 {@link com.ryuqq.milestone.core.spi.ProgressStore} 참조 구현.</p>
 *
 * @see com.ryuqq.milestone.core.spi.ProgressStore
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.milestone.adapter.inmemory.store;
