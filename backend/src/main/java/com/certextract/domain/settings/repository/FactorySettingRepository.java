package com.certextract.domain.settings.repository;

import com.certextract.domain.settings.model.FactorySetting;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;

public interface FactorySettingRepository extends JpaRepository<FactorySetting, String> {

    List<FactorySetting> findByKeyIn(Collection<String> keys);
}
