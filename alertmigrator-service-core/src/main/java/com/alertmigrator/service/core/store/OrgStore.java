package com.alertmigrator.service.core.store;

import java.util.List;

public interface OrgStore {
    List<Long> findAllOrgIds();
}
