package com.ryuqq.fleet.core.model;

/**
 * Job이 에이전트에 전달하는 명령.
 *
 * <p>commandType은 에이전트가 실행 방식을 결정하는 값(예: "command", "powershell",
 * "script", "msi")이며, body는 에이전트가 해석하는 JSON 텍스트입니다.
 * 코어는 body를 해석하지 않고 그대로 전달합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>CommandPayload.of("command", "{\"command\":\"ipconfig /all\"}")</li>
 *   <li>CommandPayload.of("powershell", "{\"script\":\"Get-Service\"}")</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class CommandPayload {

    private final String commandType;
    private final String body;

    private CommandPayload(String commandType, String body) {
        if (commandType == null || commandType.isBlank()) {
            throw new IllegalArgumentException("commandType cannot be null or blank");
        }
        this.commandType = commandType;
        // 빈 본문은 "{}"로 정규화
        this.body = body == null || body.isBlank() ? "{}" : body;
    }

    /**
     * CommandPayload 생성.
     *
     * @param commandType 명령 유형
     * @param body JSON 본문 (null이면 "{}")
     * @return CommandPayload 인스턴스
     */
    public static CommandPayload of(String commandType, String body) {
        return new CommandPayload(commandType, body);
    }

    public String getCommandType() {
        return commandType;
    }

    public String getBody() {
        return body;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CommandPayload that = (CommandPayload) o;
        return commandType.equals(that.commandType) && body.equals(that.body);
    }

    @Override
    public int hashCode() {
        return 31 * commandType.hashCode() + body.hashCode();
    }

    @Override
    public String toString() {
        return "CommandPayload{type=" + commandType + ", " + body.length() + " chars}";
    }
}
