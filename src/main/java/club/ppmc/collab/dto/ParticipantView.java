package club.ppmc.collab.dto;

/**
 * 客户端看到的房间成员: 其他成员发消息时使用的连接ID，以及加入时的身份。
 */
public record ParticipantView(String connection, String identity) {}
