package com.tokendraw.engine.repository;

import com.tokendraw.engine.model.Holder;
import java.util.List;

public interface HolderRepository {

  void upsert(Holder holder);

  List<Holder> findAll();
}
