/*
 * どこで: Certificate outbox の状態管理
 * 何を: outbox_events.status の有効値を enum で表現する
 * なぜ: レイヤ内で不正な状態値を防ぐため
 */
package com.popchain.certificate.model;

// DB の CHECK 制約と値を一致させる
public enum OutboxStatus {
  PENDING,
  IN_FLIGHT,
  PUBLISHED,
  FAILED
}
