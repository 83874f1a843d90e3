/**
 * JSON 진행 파일 어댑터.
 *
 * @see com.ryuqq.milestone.adapter.file.FileProgressStore
 */
package com.ryuqq.milestone.adapter.file;
