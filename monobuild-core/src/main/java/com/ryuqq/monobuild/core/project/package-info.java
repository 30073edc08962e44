/**
 * 모노레포 프로젝트와 프로젝트 간 의존 그래프.
 *
 * @author Monobuild Team
 * @since 1.0.0
 */
package com.ryuqq.monobuild.core.project;
