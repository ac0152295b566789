package com.pathfinder.prereq.structuring;

import java.util.List;

public class StructuringModels {
    public enum Role { SYSTEM, USER, ASSISTANT }

    public record ChatTurn(Role role, String content) {
        public static ChatTurn system(String content) {
            return new ChatTurn(Role.SYSTEM, content);
        }

        public static ChatTurn user(String content) {
            return new ChatTurn(Role.USER, content);
        }

        public static ChatTurn assistant(String content) {
            return new ChatTurn(Role.ASSISTANT, content);
        }
    }

    public record WorkedExample(String text, List<String> codes, String expectedJson) {}
}
