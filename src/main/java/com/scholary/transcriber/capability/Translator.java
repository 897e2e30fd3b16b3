package com.scholary.transcriber.capability;

/** Text translation between two language codes. */
public interface Translator {

  /**
   * @param sourceLanguage language of {@code text}; null lets the model detect it
   * @throws TranslationException if translation fails
   */
  String translate(String text, String sourceLanguage, String targetLanguage);
}
