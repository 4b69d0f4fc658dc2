package com.guildauction.repository;

import com.guildauction.model.entity.Setting;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface SettingRepository extends JpaRepository<Setting, Setting.Key> {

    List<Setting> findByKeyGuildId(long guildId);
}
