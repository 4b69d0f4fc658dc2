package com.guildauction.service;

import com.guildauction.model.GuildConfig;

/**
 * Read-only source of per-guild settings.
 */
public interface ConfigProvider {

    GuildConfig getConfig(long guildId);
}
