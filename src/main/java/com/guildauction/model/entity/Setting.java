package com.guildauction.model.entity;

import jakarta.persistence.*;
import lombok.*;

import java.io.Serializable;
import java.time.Instant;

/**
 * Guild-scoped key/value pair.
 */
@Entity
@Table(name = "settings")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Setting {

    @EmbeddedId
    private Key key;

    @Column(name = "setting_value", length = 1024)
    private String value;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Embeddable
    @Getter
    @NoArgsConstructor
    @AllArgsConstructor
    @EqualsAndHashCode
    public static class Key implements Serializable {

        @Column(name = "guild_id", nullable = false)
        private long guildId;

        @Column(name = "setting_key", nullable = false, length = 128)
        private String name;
    }
}
