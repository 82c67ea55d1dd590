/*
 * どこで: Dialer 音声応答
 * 何を: CallInstruction を通話プロバイダ向けの音声 XML へ変換する
 * なぜ: 応答 webhook のレスポンス本文を 1 箇所で組み立てるため
 */
package com.example.dialer.voice;

import com.example.dialer.config.DialerAnswerProperties;
import org.springframework.stereotype.Component;

@Component
public class VoiceXmlRenderer {

  private static final String XML_HEADER = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>";

  private final DialerAnswerProperties properties;

  public VoiceXmlRenderer(DialerAnswerProperties properties) {
    this.properties = properties;
  }

  public String render(CallInstruction instruction) {
    final StringBuilder xml = new StringBuilder(XML_HEADER).append("<Response>");
    if (instruction instanceof Hangup hangup) {
      appendSay(xml, hangup.prompt());
      xml.append("<Hangup/>");
    } else if (instruction instanceof Bridge bridge) {
      appendSay(xml, bridge.prompt());
      xml.append("<Dial><Conference")
          .append(" startConferenceOnEnter=\"false\"")
          .append(" endConferenceOnExit=\"false\"")
          .append(" beep=\"false\"")
          .append(" statusCallback=\"")
          .append(escapeXml(bridge.statusCallbackUrl()))
          .append("\" statusCallbackMethod=\"POST\"")
          .append(" statusCallbackEvent=\"start end join leave\">")
          .append(escapeXml(bridge.conferenceName()))
          .append("</Conference></Dial>");
    } else if (instruction instanceof HoldAndRetry hold) {
      appendSay(xml, hold.prompt());
      xml.append("<Pause length=\"")
          .append(Math.max(1, hold.pause().toSeconds()))
          .append("\"/>")
          .append("<Redirect method=\"POST\">")
          .append(escapeXml(hold.redirectUrl()))
          .append("</Redirect>");
    } else if (instruction instanceof RecordVoicemail voicemail) {
      appendSay(xml, voicemail.prompt());
      xml.append("<Record")
          .append(" maxLength=\"")
          .append(voicemail.maxLength().toSeconds())
          .append("\" playBeep=\"true\"")
          .append(" action=\"")
          .append(escapeXml(voicemail.recordingActionUrl()))
          .append("\" method=\"POST\"")
          .append(" transcribe=\"true\"")
          .append(" transcribeCallback=\"")
          .append(escapeXml(voicemail.transcriptionCallbackUrl()))
          .append("\"/>");
      // Record がタイムアウトした場合だけここへ進む
      appendSay(xml, voicemail.missedPrompt());
    } else {
      throw new IllegalArgumentException("unsupported call instruction: " + instruction);
    }
    return xml.append("</Response>").toString();
  }

  private void appendSay(StringBuilder xml, String prompt) {
    if (prompt == null || prompt.isBlank()) {
      return;
    }
    xml.append("<Say voice=\"")
        .append(escapeXml(properties.voice()))
        .append("\">")
        .append(escapeXml(prompt))
        .append("</Say>");
  }

  static String escapeXml(String value) {
    if (value == null) {
      return "";
    }
    return value
        .replace("&", "&amp;")
        .replace("<", "&lt;")
        .replace(">", "&gt;")
        .replace("\"", "&quot;")
        .replace("'", "&apos;");
  }
}
