package com.zzf.selfpatch.core.feature;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Locale;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ConversationTurn {
    private Role role;
    private String content;

    public enum Role {
        USER, ASSISTANT, SYSTEM;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static Role fromWireName(String name) {
            return name == null ? USER : Role.valueOf(name.trim().toUpperCase(Locale.ROOT));
        }
    }

    public static ConversationTurn user(String content) {
        return new ConversationTurn(Role.USER, content);
    }

    public static ConversationTurn assistant(String content) {
        return new ConversationTurn(Role.ASSISTANT, content);
    }

    public static ConversationTurn system(String content) {
        return new ConversationTurn(Role.SYSTEM, content);
    }
}
