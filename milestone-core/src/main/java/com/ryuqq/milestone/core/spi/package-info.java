/**
 * Service Provider Interface (SPI) 패키지.
 *
 * <p>엔진이 사용하고 인프라 어댑터가 구현하는 인터페이스를 정의합니다.</p>
 *
 * <h2>SPI 인터페이스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.milestone.core.spi.RemoteClient} - 원격 협업 API, 자격 증명당 인스턴스 하나</li>
 *   <li>{@link com.ryuqq.milestone.core.spi.ProgressStore} - 워크플로우별 진행 상황 저장소</li>
 * </ul>
 *
 * <h2>구현 책임</h2>
 * <p>어댑터 계층(milestone-adapter-inmemory, milestone-adapter-file)이 ProgressStore 구현을 제공합니다.
 * RemoteClient 구현은 배포 환경이 제공하고 CLI가 찾아 씁니다.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.milestone.core.spi;
