package club.ppmc.collab.model;

import java.util.Set;

/**
 * 一次移除操作从注册表中取出的内容。身份在清除映射之前解析，因此仍可用于“成员离开”通知。
 *
 * @param connectionId 被移除的连接。
 * @param identity     该连接注册时的身份，可能为`null`。
 * @param rooms        该连接此前所在、现已离开的房间。
 */
public record Departure(String connectionId, String identity, Set<String> rooms) {

    public Departure {
        rooms = Set.copyOf(rooms);
    }
}
