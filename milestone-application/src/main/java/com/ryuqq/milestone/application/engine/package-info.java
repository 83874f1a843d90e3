/**
 * 엔진 Port와 요청/결과 타입.
 */
package com.ryuqq.milestone.application.engine;
