/*
 * どこで: Dialer 音声応答
 * 何を: 応答 webhook が通話プロバイダへ返す指示の型を定義する
 * なぜ: 判定ロジックと XML 表現を分けてテストしやすくするため
 */
package com.example.dialer.voice;

public interface CallInstruction {}
