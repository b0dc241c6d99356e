package com.example.auth.service;

import com.example.auth.model.ProviderIdentity;
import com.example.auth.model.UserFilter;
import com.example.auth.model.UserRecord;
import java.util.List;

/**
 * User storage as seen by login validation. Uniqueness of {@code (provider, thirdPartyId)} and of
 * the access token hash is enforced here, not by callers.
 */
public interface UserDirectory {

  List<UserRecord> find(UserFilter filter);

  UserRecord create(ProviderIdentity identity);
}
