/*
 * どこで: app/healthion-api/src/main/java/com/healthion/bff/model/RegistrationOutcome.java
 * 何を: upstream 連携登録の結果種別
 */
package com.healthion.bff.model;

public enum RegistrationOutcome {
    ALREADY_LINKED,
    LINKED,
    LINKED_CONCURRENTLY
}
